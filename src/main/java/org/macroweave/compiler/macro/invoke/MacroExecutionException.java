package org.macroweave.compiler.macro.invoke;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.macro.MacroException;

/**
 * Thrown when a macro implementation fails or returns something that cannot replace its call site.
 * Fatal for the compilation unit being expanded.
 */
public class MacroExecutionException extends MacroException {

    /**
     * @param message What went wrong.
     * @param macroName The macro that failed.
     * @param span The call-site span.
     * @param cause The implementation's exception, or {@code null}.
     */
    public MacroExecutionException(String message, String macroName, SourceSpan span, Throwable cause) {
        super(MacroErrorCode.MACRO_EXECUTION_FAILED, message, macroName, span, cause);
    }
}
