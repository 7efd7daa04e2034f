package org.macroweave.compiler;

import com.typesafe.config.Config;
import org.macroweave.compiler.api.CompilationException;
import org.macroweave.compiler.api.CompilationResult;
import org.macroweave.compiler.config.ConfigLoader;
import org.macroweave.compiler.config.ExpansionSettings;
import org.macroweave.compiler.config.LoggingConfigurator;
import org.macroweave.compiler.diagnostics.DiagnosticsEngine;
import org.macroweave.compiler.frontend.lexer.Lexer;
import org.macroweave.compiler.frontend.lexer.Token;
import org.macroweave.compiler.frontend.parser.Parser;
import org.macroweave.compiler.frontend.parser.ast.CompilationUnit;
import org.macroweave.compiler.macro.MacroExpansionPass;
import org.macroweave.compiler.macro.registry.MacroRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the front half of the compiler: lexing and parsing each source, then macro expansion.
 * The units in the result are fully macro-expanded and ready for semantic analysis.
 * <p>
 * A unit with syntax errors is not expanded and is reported as failed; the other units are
 * still processed so that all diagnostics of a run are reported together.
 */
public class MacroCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(MacroCompiler.class);

    private final MacroRegistry registry;
    private final ExpansionSettings settings;

    /**
     * Creates a compiler configured from {@value ConfigLoader#DEFAULT_CONFIG_FILE_NAME}, system
     * properties and the built-in defaults, and applies the logging settings found there.
     *
     * @param registry The populated registry; it is frozen here if it is not already.
     * @return The compiler.
     */
    public static MacroCompiler withDefaultConfiguration(MacroRegistry registry) {
        Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        return new MacroCompiler(registry, config);
    }

    /**
     * @param registry The populated registry; it is frozen here if it is not already.
     * @param config The loaded configuration.
     */
    public MacroCompiler(MacroRegistry registry, Config config) {
        this(registry, ExpansionSettings.fromConfig(config));
    }

    /**
     * @param registry The populated registry; it is frozen here if it is not already.
     * @param settings The expansion settings.
     */
    public MacroCompiler(MacroRegistry registry, ExpansionSettings settings) {
        this.registry = registry.freeze();
        this.settings = settings;
    }

    /**
     * Compiles the given sources.
     *
     * @param sources Source text by file name; iteration order is the unit order.
     * @return The expanded units, failed unit names and diagnostics.
     */
    public CompilationResult compile(Map<String, String> sources) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<CompilationUnit> parsed = new ArrayList<>();
        List<String> syntaxFailures = new ArrayList<>();

        sources.forEach((fileName, source) -> {
            DiagnosticsEngine unitDiagnostics = new DiagnosticsEngine();
            CompilationUnit unit = parse(fileName, source, unitDiagnostics);
            diagnostics.addAll(unitDiagnostics);
            if (unitDiagnostics.hasErrors()) {
                syntaxFailures.add(fileName);
            } else {
                parsed.add(unit);
            }
        });

        CompilationResult result = new MacroExpansionPass(registry, settings).run(parsed, diagnostics)
                .withEarlierFailures(syntaxFailures);
        if (!result.isSuccess()) {
            LOG.warn("{} compilation unit(s) failed: {}", result.failedUnits().size(), result.failedUnits());
        }
        return result;
    }

    /**
     * Compiles the given sources and fails if any unit failed.
     *
     * @param sources Source text by file name.
     * @return The expanded units.
     * @throws CompilationException carrying all diagnostics, if any unit failed.
     */
    public List<CompilationUnit> compileOrThrow(Map<String, String> sources) throws CompilationException {
        CompilationResult result = compile(sources);
        if (!result.isSuccess()) {
            throw new CompilationException(result.summary());
        }
        return result.units();
    }

    /**
     * Lexes and parses one source.
     *
     * @param fileName The logical file name.
     * @param source The source text.
     * @param diagnostics Receives lexical and syntax errors.
     * @return The parsed unit; it contains only the statements that parsed.
     */
    public static CompilationUnit parse(String fileName, String source, DiagnosticsEngine diagnostics) {
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();
        return new Parser(tokens, diagnostics, fileName).parse();
    }
}
