package org.macroweave.compiler.macro.template;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.macro.MacroException;

import java.util.List;

/**
 * Thrown when a template is materialized while one or more of its holes have no binding.
 * Fatal for the compilation unit that was being expanded.
 */
public class UnresolvedHoleException extends MacroException {

    private final List<String> unresolvedHoles;

    /**
     * @param unresolvedHoles The names of all holes that had no binding, in template order.
     */
    public UnresolvedHoleException(List<String> unresolvedHoles) {
        super(MacroErrorCode.UNRESOLVED_HOLE,
                "Template hole(s) without binding: " + String.join(", ", unresolvedHoles),
                null, null, null);
        this.unresolvedHoles = List.copyOf(unresolvedHoles);
    }

    public List<String> getUnresolvedHoles() {
        return unresolvedHoles;
    }
}
