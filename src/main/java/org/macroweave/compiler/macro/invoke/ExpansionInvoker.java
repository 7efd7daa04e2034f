package org.macroweave.compiler.macro.invoke;

import org.macroweave.compiler.frontend.TreeWalker;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.CallNode;
import org.macroweave.compiler.frontend.parser.ast.HoleNode;
import org.macroweave.compiler.frontend.parser.ast.NodeKind;
import org.macroweave.compiler.macro.MacroException;
import org.macroweave.compiler.macro.location.LocationTracker;
import org.macroweave.compiler.macro.registry.MacroDefinition;
import org.macroweave.compiler.macro.spi.CompileTimeConfig;
import org.macroweave.compiler.macro.spi.MacroContext;
import org.macroweave.compiler.macro.spi.ReplacementResult;
import org.macroweave.compiler.macro.spi.ScopeView;
import org.macroweave.compiler.macro.template.TemplateEngine;
import org.macroweave.compiler.macro.template.UnresolvedHoleException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Runs a matched macro against a call site.
 * <p>
 * The implementation receives a fresh {@link MacroContext} and the raw argument nodes, never
 * their values. Its result is located: every node it introduced takes the call-site span,
 * while captured argument subtrees and deliberately synthetic nodes keep theirs.
 */
public class ExpansionInvoker {

    private final TemplateEngine templates;
    private final CompileTimeConfig config;

    /**
     * @param templates The template engine handed to implementations.
     * @param config The compile-time configuration granted for the current pass.
     */
    public ExpansionInvoker(TemplateEngine templates, CompileTimeConfig config) {
        this.templates = templates;
        this.config = config;
    }

    /**
     * @param definition The matched definition.
     * @param callSite The call site it matched.
     * @param enclosingScope The scope around the call site.
     * @return The located replacement, or the empty marker.
     * @throws MacroExecutionException if the implementation throws, overflows the stack, hits a
     *                                  linkage error or returns {@code null}. Other JVM errors propagate.
     * @throws UnresolvedHoleException if the implementation misused a template.
     */
    public ReplacementResult invoke(MacroDefinition definition, CallNode callSite, ScopeView enclosingScope) {
        MacroContext context = new MacroContext(definition.name(), callSite.span(), enclosingScope, config, templates);

        ReplacementResult result;
        try {
            result = definition.implementation().expand(context, callSite.arguments());
        } catch (MacroException e) {
            // Template and recursion errors keep their own category.
            throw e.locatedAt(definition.name(), callSite.span());
        } catch (RuntimeException | AssertionError | StackOverflowError | LinkageError e) {
            throw new MacroExecutionException("Macro implementation failed: " + describe(e), definition.name(), callSite.span(), e);
        }

        if (result == null) {
            throw new MacroExecutionException("Macro implementation returned null instead of a replacement.",
                    definition.name(), callSite.span(), null);
        }
        if (result.isEmpty()) {
            return result;
        }

        AstNode node = result.node().orElseThrow();
        Set<String> leftoverHoles = holesIn(node);
        if (!leftoverHoles.isEmpty()) {
            throw new UnresolvedHoleException(new ArrayList<>(leftoverHoles)).locatedAt(definition.name(), callSite.span());
        }
        return ReplacementResult.of(LocationTracker.propagate(node, callSite.span()));
    }

    private static Set<String> holesIn(AstNode node) {
        Set<String> holes = new LinkedHashSet<>();
        new TreeWalker(Map.of(NodeKind.HOLE, n -> holes.add(((HoleNode) n).name()))).walk(node);
        return holes;
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null ? root.getClass().getSimpleName() : message;
    }
}
