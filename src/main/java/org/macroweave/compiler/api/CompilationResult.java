package org.macroweave.compiler.api;

import org.macroweave.compiler.diagnostics.Diagnostic;
import org.macroweave.compiler.frontend.parser.ast.CompilationUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outcome of one run: the fully expanded units that may go on to later phases, the names
 * of the units that failed and must not, and every diagnostic collected along the way.
 *
 * @param units The successfully expanded units, in input order.
 * @param failedUnits The file names of the units that failed, in the order they failed.
 * @param diagnostics All diagnostics of the run.
 */
public record CompilationResult(
        List<CompilationUnit> units,
        List<String> failedUnits,
        List<Diagnostic> diagnostics
) {

    public CompilationResult {
        units = List.copyOf(units);
        failedUnits = List.copyOf(failedUnits);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return failedUnits.isEmpty();
    }

    /**
     * @return 0 if every unit compiled, 1 if any unit failed.
     */
    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }

    /**
     * @param fileName A unit's file name.
     * @return The expanded unit, empty if the unit failed or does not exist.
     */
    public Optional<CompilationUnit> unit(String fileName) {
        return units.stream().filter(u -> u.fileName().equals(fileName)).findFirst();
    }

    /**
     * @param earlierFailures Units that failed before this result was produced (e.g. while parsing).
     * @return A result that also lists them as failed, ahead of the existing failures.
     */
    public CompilationResult withEarlierFailures(List<String> earlierFailures) {
        List<String> merged = new ArrayList<>(earlierFailures);
        merged.addAll(failedUnits);
        return new CompilationResult(units, merged, diagnostics);
    }

    /**
     * @return All diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
