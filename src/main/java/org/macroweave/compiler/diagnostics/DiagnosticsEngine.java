package org.macroweave.compiler.diagnostics;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during parsing and macro expansion.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, expansion driver).
 * All writes go through a single lock, so units expanding on different threads never
 * interleave within the sink; diagnostics of one unit keep their relative order.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code         The stable error code.
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     */
    public void reportError(MacroErrorCode code, String message, String fileName, int lineNumber, int columnNumber) {
        add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber, columnNumber, null));
    }

    /**
     * Reports an error that is tied to a macro.
     *
     * @param code      The stable error code.
     * @param message   The error message.
     * @param span      The call-site span, or {@code null} if unknown.
     * @param macroName The macro involved, or {@code null}.
     */
    public void reportError(MacroErrorCode code, String message, SourceSpan span, String macroName) {
        SourceSpan at = span != null ? span : SourceSpan.SYNTHETIC;
        add(new Diagnostic(Diagnostic.Type.ERROR, code, message, at.file(), at.startLine(), at.startColumn(), macroName));
    }

    /**
     * Reports a warning.
     *
     * @param message      The warning message.
     * @param fileName     The file in which the warning occurred.
     * @param lineNumber   The line number of the warning.
     * @param columnNumber The column number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber, int columnNumber) {
        add(new Diagnostic(Diagnostic.Type.WARNING, null, message, fileName, lineNumber, columnNumber, null));
    }

    /**
     * Appends all diagnostics of another engine, keeping their order.
     * Used to merge a unit-local engine into the shared run-wide sink in one step.
     *
     * @param other The engine to drain.
     */
    public void addAll(DiagnosticsEngine other) {
        List<Diagnostic> snapshot = other.getDiagnostics();
        synchronized (diagnostics) {
            diagnostics.addAll(snapshot);
        }
    }

    private void add(Diagnostic diagnostic) {
        synchronized (diagnostics) {
            diagnostics.add(diagnostic);
        }
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        synchronized (diagnostics) {
            return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
        }
    }

    /**
     * Returns an unmodifiable snapshot of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        synchronized (diagnostics) {
            return Collections.unmodifiableList(new ArrayList<>(diagnostics));
        }
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return getDiagnostics().stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
