package org.macroweave.compiler;

import com.typesafe.config.ConfigFactory;
import org.macroweave.compiler.api.CompilationException;
import org.macroweave.compiler.api.CompilationResult;
import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.config.ExpansionSettings;
import org.macroweave.compiler.config.LoggingConfigurator;
import org.macroweave.compiler.diagnostics.Diagnostic;
import org.macroweave.compiler.diagnostics.DiagnosticsEngine;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.CompilationUnit;
import org.macroweave.compiler.macro.location.LocationTracker;
import org.macroweave.compiler.macro.registry.MacroRegistry;
import org.macroweave.compiler.macro.spi.MacroContext;
import org.macroweave.compiler.macro.spi.MacroMethod;
import org.macroweave.compiler.macro.spi.ReplacementResult;
import org.macroweave.compiler.macro.template.Bindings;
import org.macroweave.junit.extensions.logging.ExpectLog;
import org.macroweave.junit.extensions.logging.LogLevel;
import org.macroweave.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of the compiler front half: sources in, macro-expanded units and
 * diagnostics out. The {@code warn} macro reports a failed condition with the call-site
 * location, and is compiled away entirely unless the {@code debug-warnings} build flag is set.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class MacroCompilerTest {

    private static final String WARN_CALL = "warn(age >= 18, \"x\")";

    public static class WarnMacros {
        @MacroMethod
        public ReplacementResult warn(MacroContext context, AstNode cond, AstNode msg) {
            if (!context.config().getBoolean("debug-warnings", false)) {
                return ReplacementResult.empty();
            }
            return ReplacementResult.of(context.quote("!(${cond}) && println(#{location} + \": \" + ${msg})", Bindings.create()
                    .expression("cond", cond)
                    .expression("msg", msg)
                    .value("location", context.locationString())));
        }

        @MacroMethod
        public AstNode boom(MacroContext context, AstNode argument) {
            throw new IllegalArgumentException("cannot expand " + argument.kind());
        }

        @MacroMethod
        public AstNode broken(MacroContext context, AstNode argument) {
            throw new AssertionError("impl bug");
        }

        @MacroMethod
        public AstNode bottomless(MacroContext context, AstNode argument) {
            return bottomless(context, argument);
        }
    }

    private static MacroCompiler compiler(boolean debugWarnings) {
        MacroRegistry registry = new MacroRegistry();
        registry.registerAnnotated(new WarnMacros());
        return new MacroCompiler(registry, ConfigFactory.parseString(
                "macro.compile-time.debug-warnings = " + debugWarnings).withFallback(ConfigFactory.parseResources("reference.conf")));
    }

    private static AstNode parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        CompilationUnit unit = MacroCompiler.parse("expected.mw", source, diagnostics);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return unit.statements().get(0);
    }

    @Test
    void warnCompilesToNothingWhenFlagIsOff() {
        // Act
        CompilationResult result = compiler(false).compile(Map.of("main.mw", WARN_CALL));

        // Assert
        assertThat(result.exitCode()).isZero();
        assertThat(result.unit("main.mw")).hasValueSatisfying(unit -> assertThat(unit.statements()).isEmpty());
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void warnExpandsToLocatedCheckWhenFlagIsOn() {
        // Act
        CompilationResult result = compiler(true).compile(Map.of("main.mw", WARN_CALL));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        List<AstNode> statements = result.unit("main.mw").orElseThrow().statements();
        assertThat(statements).hasSize(1);
        AstNode expanded = statements.get(0);
        assertThat(LocationTracker.sameStructure(expanded,
                parse("!(age >= 18) && println(\"main.mw:1:1\" + \": \" + \"x\")"))).isTrue();
        assertThat(expanded.span()).isEqualTo(new SourceSpan("main.mw", 1, 1, 1, 20));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*MacroCompiler", messagePattern = "2 compilation unit\\(s\\) failed.*")
    void failingUnitsAreReportedTogetherAndExcluded() {
        // Arrange
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("broken.mw", "val = 1");
        sources.put("failing.mw", "ok()\nboom(x + 1)");
        sources.put("good.mw", "warn(a, b)\nprintln(1)");

        // Act
        CompilationResult result = compiler(false).compile(sources);

        // Assert
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.failedUnits()).containsExactly("broken.mw", "failing.mw");
        assertThat(result.units()).extracting(CompilationUnit::fileName).containsExactly("good.mw");
        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                .containsExactly(MacroErrorCode.SYNTAX_ERROR, MacroErrorCode.MACRO_EXECUTION_FAILED);
        assertThat(result.diagnostics().get(1))
                .hasToString("failing.mw:2:1: boom: Macro implementation failed: cannot expand BINARY_OP");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*MacroCompiler")
    void compileOrThrowCarriesAllDiagnostics() {
        // Arrange
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a.mw", "boom(1)");
        sources.put("b.mw", "boom(2)");

        // Act & Assert
        assertThatThrownBy(() -> compiler(true).compileOrThrow(sources))
                .isInstanceOf(CompilationException.class)
                .hasMessage("a.mw:1:1: boom: Macro implementation failed: cannot expand LITERAL\n"
                        + "b.mw:1:1: boom: Macro implementation failed: cannot expand LITERAL");
    }

    @Test
    void compileOrThrowReturnsExpandedUnits() throws CompilationException {
        // Act
        List<CompilationUnit> units = compiler(false).compileOrThrow(Map.of("main.mw", "val age = 20\n" + WARN_CALL));

        // Assert
        assertThat(units).singleElement().satisfies(unit -> assertThat(unit.statements()).hasSize(1));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*MacroCompiler", messagePattern = "2 compilation unit\\(s\\) failed.*", occurrences = 2)
    void errorsThrownByMacrosFailOnlyTheirOwnUnit() {
        // Arrange
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a.mw", "broken(1)");
        sources.put("b.mw", "println(1)");
        sources.put("c.mw", "\n  bottomless(2)");
        MacroRegistry registry = new MacroRegistry();
        registry.registerAnnotated(new WarnMacros());

        for (int parallelism : new int[] {1, 3}) {
            // Act
            CompilationResult result = new MacroCompiler(registry, new ExpansionSettings(8, parallelism, null)).compile(sources);

            // Assert
            assertThat(result.failedUnits()).containsExactly("a.mw", "c.mw");
            assertThat(result.units()).extracting(CompilationUnit::fileName).containsExactly("b.mw");
            assertThat(result.diagnostics()).extracting(Diagnostic::code)
                    .containsOnly(MacroErrorCode.MACRO_EXECUTION_FAILED);
            assertThat(result.diagnostics()).extracting(Diagnostic::toString).containsExactlyInAnyOrder(
                    "a.mw:1:1: broken: Macro implementation failed: impl bug",
                    "c.mw:2:3: bottomless: Macro implementation failed: StackOverflowError");
        }
    }

    @Test
    void defaultConfigurationAppliesReferenceSettings() {
        // Arrange
        LoggingConfigurator.reset();
        ConfigFactory.invalidateCaches();
        MacroRegistry registry = new MacroRegistry();
        registry.registerAnnotated(new WarnMacros());

        try {
            // Act
            CompilationResult result = MacroCompiler.withDefaultConfiguration(registry).compile(Map.of("main.mw", WARN_CALL));

            // Assert
            assertThat(registry.isFrozen()).isTrue();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.unit("main.mw")).hasValueSatisfying(unit -> assertThat(unit.statements()).isEmpty());
        } finally {
            LoggingConfigurator.reset();
        }
    }

    @Test
    void settingsConstructorFreezesRegistry() {
        // Arrange
        MacroRegistry registry = new MacroRegistry();

        // Act
        new MacroCompiler(registry, ExpansionSettings.defaults());

        // Assert
        assertThat(registry.isFrozen()).isTrue();
    }
}
