package org.macroweave.compiler.macro.template;

import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.diagnostics.DiagnosticsEngine;
import org.macroweave.compiler.frontend.TreeWalker;
import org.macroweave.compiler.frontend.lexer.Lexer;
import org.macroweave.compiler.frontend.lexer.Token;
import org.macroweave.compiler.frontend.parser.Parser;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.CompilationUnit;
import org.macroweave.compiler.frontend.parser.ast.HoleNode;
import org.macroweave.compiler.frontend.parser.ast.LiteralNode;
import org.macroweave.compiler.frontend.parser.ast.NodeKind;
import org.macroweave.compiler.macro.location.LocationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses quasiquoted code into {@link Template}s and materializes templates into concrete AST.
 * <p>
 * Template syntax is ordinary host syntax plus two kinds of holes in expression position:
 * <ul>
 *   <li>{@code ${name}} (expression splice) embeds a captured subtree unchanged; it is not
 *       re-parsed, so its internal structure and its source spans are preserved.</li>
 *   <li>{@code #{name}} (value splice) converts a computed scalar or string into a literal node.</li>
 * </ul>
 * Materialization is pure structural substitution: nothing is evaluated or type-checked.
 * Parsed templates are cached by source text, up to a fixed number of entries; templates parsed
 * after the cache is full are not kept. The engine is safe to share between threads, and a
 * {@link org.macroweave.compiler.macro.MacroExpansionPass} normally creates one per pass.
 */
public class TemplateEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateEngine.class);
    private static final String TEMPLATE_FILE_NAME = "<template>";

    /** The number of parsed templates kept by the no-argument constructor. */
    public static final int DEFAULT_CACHE_CAPACITY = 512;

    private final Map<String, Template> cache = new ConcurrentHashMap<>();
    private final int cacheCapacity;

    public TemplateEngine() {
        this(DEFAULT_CACHE_CAPACITY);
    }

    /**
     * @param cacheCapacity The maximum number of parsed templates kept; 0 disables caching.
     */
    public TemplateEngine(int cacheCapacity) {
        if (cacheCapacity < 0) {
            throw new IllegalArgumentException("Template cache capacity must not be negative, was " + cacheCapacity + ".");
        }
        this.cacheCapacity = cacheCapacity;
    }

    /**
     * Parses template source into a reusable skeleton. Repeated calls with the same source
     * return the same {@link Template} instance while it is cached.
     *
     * @param source The quasiquoted code; exactly one expression or statement.
     * @return The parsed template.
     * @throws TemplateSyntaxException if the source does not parse, does not consist of exactly one
     *                                 statement, or uses one hole name with both hole kinds.
     */
    public Template parse(String source) {
        Template cached = cache.get(source);
        if (cached != null) {
            return cached;
        }
        Template parsed = parseUncached(source);
        // The size check races with other threads; the cache may overshoot by a few entries.
        if (cache.size() >= cacheCapacity) {
            return parsed;
        }
        Template previous = cache.putIfAbsent(source, parsed);
        return previous != null ? previous : parsed;
    }

    private Template parseUncached(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics, TEMPLATE_FILE_NAME).scanTokens();
        CompilationUnit unit = Parser.forTemplate(tokens, diagnostics, TEMPLATE_FILE_NAME).parse();

        if (diagnostics.hasErrors()) {
            throw new TemplateSyntaxException("Invalid template '" + source + "':\n" + diagnostics.summary());
        }
        if (unit.statements().size() != 1) {
            throw new TemplateSyntaxException("Template '" + source + "' must contain exactly one expression or statement, but has "
                    + unit.statements().size() + ".");
        }

        Map<String, HoleNode.HoleKind> holes = new LinkedHashMap<>();
        List<String> conflicts = new ArrayList<>();
        new TreeWalker(Map.of(NodeKind.HOLE, node -> {
            HoleNode hole = (HoleNode) node;
            HoleNode.HoleKind previous = holes.putIfAbsent(hole.name(), hole.holeKind());
            if (previous != null && previous != hole.holeKind()) {
                conflicts.add(hole.name());
            }
        })).walk(unit.statements().get(0));

        if (!conflicts.isEmpty()) {
            throw new TemplateSyntaxException("Template '" + source + "' uses hole(s) " + conflicts
                    + " both as expression splice and as value splice.");
        }

        LOG.debug("Parsed template '{}' with holes {}", source, holes.keySet());
        return new Template(source, LocationTracker.unassign(unit.statements().get(0)), holes);
    }

    /**
     * Fills every hole of the template and returns the concrete tree.
     *
     * @param template The template to materialize.
     * @param expressionBindings Captured subtrees for the {@code ${name}} holes.
     * @param valueBindings Computed values for the {@code #{name}} holes; {@code null} values are allowed.
     * @return A new tree without holes. Template-born nodes carry
     *         {@link SourceSpan#UNASSIGNED} until the expansion locates them.
     * @throws UnresolvedHoleException if any hole has no binding of its kind.
     * @throws IllegalArgumentException if a value binding has a type that has no literal form.
     */
    public AstNode materialize(Template template, Map<String, AstNode> expressionBindings, Map<String, Object> valueBindings) {
        List<String> unresolved = new ArrayList<>();
        template.holes().forEach((name, kind) -> {
            boolean bound = kind == HoleNode.HoleKind.EXPRESSION_SPLICE
                    ? expressionBindings.get(name) != null
                    : valueBindings.containsKey(name);
            if (!bound) {
                unresolved.add(name);
            }
        });
        if (!unresolved.isEmpty()) {
            throw new UnresolvedHoleException(unresolved);
        }

        return TreeWalker.transform(template.skeleton(), node -> {
            if (node.kind() != NodeKind.HOLE) {
                return node;
            }
            HoleNode hole = (HoleNode) node;
            if (hole.holeKind() == HoleNode.HoleKind.EXPRESSION_SPLICE) {
                return expressionBindings.get(hole.name());
            }
            return toLiteral(valueBindings.get(hole.name()), SourceSpan.UNASSIGNED);
        });
    }

    /**
     * Fills every hole of the template from a {@link Bindings} builder.
     *
     * @param template The template to materialize.
     * @param bindings The hole values.
     * @return A new tree without holes.
     */
    public AstNode materialize(Template template, Bindings bindings) {
        return materialize(template, bindings.expressions(), bindings.values());
    }

    /**
     * Converts a computed value to the literal node that represents it.
     *
     * @param value A string, character, boolean, integral or floating-point number, or {@code null}.
     * @param span The span to give the literal.
     * @return The literal node.
     * @throws IllegalArgumentException for any other type.
     */
    public static LiteralNode toLiteral(Object value, SourceSpan span) {
        if (value == null) {
            return LiteralNode.ofNull(span);
        }
        if (value instanceof String s) {
            return LiteralNode.ofString(s, span);
        }
        if (value instanceof Character c) {
            return LiteralNode.ofString(String.valueOf(c), span);
        }
        if (value instanceof Boolean b) {
            return LiteralNode.ofBoolean(b, span);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return LiteralNode.ofInteger(((Number) value).longValue(), span);
        }
        if (value instanceof Double || value instanceof Float) {
            return LiteralNode.ofFloat(((Number) value).doubleValue(), span);
        }
        throw new IllegalArgumentException("Cannot splice a value of type " + value.getClass().getName() + " as a literal.");
    }
}
