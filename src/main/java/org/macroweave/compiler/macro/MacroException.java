package org.macroweave.compiler.macro;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.api.SourceSpan;

/**
 * Base class of all errors raised while registering or expanding macros.
 * <p>
 * Carries a stable {@link MacroErrorCode} and, where known, the macro involved and the
 * call-site span. Errors raised deeper down (e.g. inside a template) may not know either;
 * the invoker fills them in with {@link #locatedAt} for the call site it was expanding.
 */
public class MacroException extends RuntimeException {

    private final MacroErrorCode code;
    private String macroName;
    private SourceSpan span;

    /**
     * @param code The error code.
     * @param message The detail message, without location prefix.
     * @param macroName The macro involved, or {@code null}.
     * @param span The call-site span, or {@code null}.
     * @param cause The underlying cause, or {@code null}.
     */
    public MacroException(MacroErrorCode code, String message, String macroName, SourceSpan span, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.macroName = macroName;
        this.span = span;
    }

    public MacroErrorCode getCode() {
        return code;
    }

    public String getMacroName() {
        return macroName;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Fills in the macro name and call-site span if they are still unknown.
     *
     * @param macroName The macro being expanded.
     * @param span The call site being expanded.
     * @return this
     */
    public MacroException locatedAt(String macroName, SourceSpan span) {
        if (this.macroName == null) {
            this.macroName = macroName;
        }
        if (this.span == null) {
            this.span = span;
        }
        return this;
    }
}
