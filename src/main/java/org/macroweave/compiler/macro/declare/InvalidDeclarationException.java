package org.macroweave.compiler.macro.declare;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.macro.MacroException;

/**
 * Thrown when a tagged library method cannot be turned into a macro definition. Fatal for the
 * whole run: it happens while the registry is populated.
 */
public class InvalidDeclarationException extends MacroException {

    /**
     * @param message The detail message, naming the offending method.
     * @param macroName The macro being declared, or {@code null} if not known yet.
     */
    public InvalidDeclarationException(String message, String macroName) {
        super(MacroErrorCode.INVALID_DECLARATION, message, macroName, null, null);
    }
}
