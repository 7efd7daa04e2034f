package org.macroweave.compiler.macro;

import org.macroweave.compiler.api.CompilationResult;
import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.config.ExpansionSettings;
import org.macroweave.compiler.diagnostics.DiagnosticsEngine;
import org.macroweave.compiler.frontend.parser.ast.CompilationUnit;
import org.macroweave.compiler.macro.expand.MacroExpansionDriver;
import org.macroweave.compiler.macro.invoke.ExpansionInvoker;
import org.macroweave.compiler.macro.match.CallSiteMatcher;
import org.macroweave.compiler.macro.registry.MacroRegistry;
import org.macroweave.compiler.macro.spi.CompileTimeConfig;
import org.macroweave.compiler.macro.template.TemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * The macro expansion phase: maps parsed units and a frozen registry to expanded units and
 * diagnostics, before any later phase runs.
 * <p>
 * Each unit is expanded independently. A failure aborts only its own unit: the error is
 * reported and the unit is left out of the result, while the remaining units carry on so that
 * all errors of the run are collected together. With a parallelism above one, units are
 * expanded on a fixed thread pool; the registry is read-only and the diagnostics sink is
 * serialized, so no further coordination is needed.
 * <p>
 * Compile-time configuration is readable by macros only while {@link #run} executes.
 */
public class MacroExpansionPass {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpansionPass.class);

    private final MacroRegistry registry;
    private final ExpansionSettings settings;
    private final TemplateEngine templates;

    /**
     * @param registry The frozen registry.
     * @param settings Depth limit, parallelism and compile-time values.
     */
    public MacroExpansionPass(MacroRegistry registry, ExpansionSettings settings) {
        this(registry, settings, new TemplateEngine());
    }

    /**
     * @param registry The frozen registry.
     * @param settings Depth limit, parallelism and compile-time values.
     * @param templates The template engine handed to macro implementations.
     */
    public MacroExpansionPass(MacroRegistry registry, ExpansionSettings settings, TemplateEngine templates) {
        if (!registry.isFrozen()) {
            throw new IllegalStateException("Macro registry must be frozen before expansion starts.");
        }
        this.registry = registry;
        this.settings = settings;
        this.templates = templates;
    }

    /**
     * Expands all units, reporting into a fresh diagnostics sink.
     * @param units The parsed units.
     * @return The expanded units, failed unit names and diagnostics.
     */
    public CompilationResult run(List<CompilationUnit> units) {
        return run(units, new DiagnosticsEngine());
    }

    /**
     * Expands all units.
     *
     * @param units The parsed units.
     * @param diagnostics The run-wide sink; diagnostics already in it are kept in the result.
     * @return The expanded units in input order, the failed unit names and all diagnostics.
     */
    public CompilationResult run(List<CompilationUnit> units, DiagnosticsEngine diagnostics) {
        try (CompileTimeConfig.Grant grant = CompileTimeConfig.grant(settings.compileTimeValues())) {
            ExpansionInvoker invoker = new ExpansionInvoker(templates, grant.config());
            MacroExpansionDriver driver = new MacroExpansionDriver(registry, new CallSiteMatcher(), invoker, settings.maxDepth());

            List<CompilationUnit> expanded = settings.parallelism() > 1 && units.size() > 1
                    ? expandConcurrently(driver, units, diagnostics)
                    : expandSequentially(driver, units, diagnostics);

            List<CompilationUnit> succeeded = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            for (int i = 0; i < units.size(); i++) {
                if (expanded.get(i) != null) {
                    succeeded.add(expanded.get(i));
                } else {
                    failed.add(units.get(i).fileName());
                }
            }
            LOG.info("Macro expansion finished: {} unit(s) expanded, {} failed", succeeded.size(), failed.size());
            return new CompilationResult(succeeded, failed, diagnostics.getDiagnostics());
        }
    }

    private List<CompilationUnit> expandSequentially(MacroExpansionDriver driver, List<CompilationUnit> units, DiagnosticsEngine diagnostics) {
        List<CompilationUnit> expanded = new ArrayList<>(units.size());
        for (CompilationUnit unit : units) {
            expanded.add(expandUnit(driver, unit, diagnostics));
        }
        return expanded;
    }

    private List<CompilationUnit> expandConcurrently(MacroExpansionDriver driver, List<CompilationUnit> units, DiagnosticsEngine diagnostics) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.parallelism(), units.size()));
        try {
            List<Future<CompilationUnit>> futures = new ArrayList<>(units.size());
            for (CompilationUnit unit : units) {
                futures.add(executor.submit(() -> expandUnit(driver, unit, diagnostics)));
            }
            List<CompilationUnit> expanded = new ArrayList<>(units.size());
            for (Future<CompilationUnit> future : futures) {
                expanded.add(future.get());
            }
            return expanded;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while expanding compilation units.", e);
        } catch (ExecutionException e) {
            // expandUnit reports every unit failure itself; only fatal JVM errors reach this point.
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unexpected failure while expanding compilation units.", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * @return The expanded unit, or {@code null} if it failed. Failures are reported to {@code diagnostics}.
     */
    private CompilationUnit expandUnit(MacroExpansionDriver driver, CompilationUnit unit, DiagnosticsEngine diagnostics) {
        try {
            return driver.expand(unit);
        } catch (MacroException e) {
            diagnostics.reportError(e.getCode(), e.getMessage(), e.getSpan(), e.getMacroName());
            LOG.debug("Macro expansion failed in {}: {}", unit.fileName(), e.getMessage(), e);
            return null;
        } catch (RuntimeException | AssertionError | StackOverflowError | LinkageError e) {
            diagnostics.reportError(MacroErrorCode.UNKNOWN_ERROR, "Unexpected error during macro expansion: " + e,
                    unit.fileName(), 0, 0);
            LOG.error("Unexpected error while expanding {}", unit.fileName(), e);
            return null;
        }
    }
}
