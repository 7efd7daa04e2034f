package org.macroweave.compiler.diagnostics;

import org.macroweave.compiler.api.MacroErrorCode;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during parsing or macro expansion.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The stable error code, or {@code null} for warnings and infos.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 * @param macroName The macro involved, or {@code null} if the issue is not tied to a macro.
 */
public record Diagnostic(
        Type type,
        MacroErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber,
        String macroName
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the unit from reaching later phases. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * Renders the diagnostic as {@code <file>:<line>:<column>: <macroName>: <message>}.
     * The macro name segment is omitted when no macro is involved.
     */
    @Override
    public String toString() {
        if (macroName == null) {
            return String.format("%s:%d:%d: %s", fileName, lineNumber, columnNumber, message);
        }
        return String.format("%s:%d:%d: %s: %s", fileName, lineNumber, columnNumber, macroName, message);
    }
}
