package org.macroweave.compiler.macro.expand;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.macro.MacroException;

/**
 * Thrown when expanding a call would nest macro expansions deeper than the configured limit.
 * Fatal for the compilation unit being expanded.
 */
public class RecursionLimitException extends MacroException {

    private final int maxDepth;

    /**
     * @param macroName The macro whose expansion would exceed the limit.
     * @param span The span of its call site.
     * @param maxDepth The configured limit.
     */
    public RecursionLimitException(String macroName, SourceSpan span, int maxDepth) {
        super(MacroErrorCode.RECURSION_LIMIT,
                "Macro expansion exceeded the maximum depth of " + maxDepth + ".",
                macroName, span, null);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
