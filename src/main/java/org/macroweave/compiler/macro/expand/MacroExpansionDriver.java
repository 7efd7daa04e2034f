package org.macroweave.compiler.macro.expand;

import org.macroweave.compiler.config.ExpansionSettings;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.AstPrinter;
import org.macroweave.compiler.frontend.parser.ast.CallNode;
import org.macroweave.compiler.frontend.parser.ast.CompilationUnit;
import org.macroweave.compiler.frontend.parser.ast.DeclarationNode;
import org.macroweave.compiler.frontend.parser.ast.LambdaNode;
import org.macroweave.compiler.frontend.parser.ast.NodeKind;
import org.macroweave.compiler.macro.MacroException;
import org.macroweave.compiler.macro.invoke.ExpansionInvoker;
import org.macroweave.compiler.macro.invoke.MacroExecutionException;
import org.macroweave.compiler.macro.match.CallSiteMatcher;
import org.macroweave.compiler.macro.match.MatchResult;
import org.macroweave.compiler.macro.registry.MacroDefinition;
import org.macroweave.compiler.macro.registry.MacroRegistry;
import org.macroweave.compiler.macro.spi.ReplacementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Expands every macro call in a compilation unit.
 * <p>
 * The walk is depth-first and outside-in: a call node is offered to the matcher before its
 * arguments are visited, so a macro always receives its arguments as written. When a call
 * matches, the macro runs, its result replaces the call, and the result is rescanned for
 * further macro calls. Nodes the macro introduced are rescanned one level deeper; argument
 * subtrees it passed through unchanged keep the depth of the call that received them, so
 * nesting written in the source never counts as recursion. A call whose expansion would exceed
 * the maximum depth fails the unit with {@link RecursionLimitException}. Calls that match
 * nothing are left as they are and their arguments are scanned.
 * <p>
 * An empty result deletes a call in statement position. A call used as a value cannot be
 * deleted; that is reported as a {@link MacroExecutionException}.
 * <p>
 * One driver may expand many units, also concurrently: it holds no per-unit state.
 */
public class MacroExpansionDriver {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpansionDriver.class);

    private final MacroRegistry registry;
    private final CallSiteMatcher matcher;
    private final ExpansionInvoker invoker;
    private final int maxDepth;

    /**
     * @param registry The frozen registry.
     * @param matcher The call-site matcher.
     * @param invoker The invoker for matched macros.
     * @param maxDepth The maximum number of nested expansions; between 1 and {@value ExpansionSettings#MAX_DEPTH_CEILING}.
     */
    public MacroExpansionDriver(MacroRegistry registry, CallSiteMatcher matcher, ExpansionInvoker invoker, int maxDepth) {
        if (!registry.isFrozen()) {
            throw new IllegalStateException("Macro registry must be frozen before expansion starts.");
        }
        if (maxDepth < 1 || maxDepth > ExpansionSettings.MAX_DEPTH_CEILING) {
            throw new IllegalArgumentException("Maximum expansion depth must be between 1 and "
                    + ExpansionSettings.MAX_DEPTH_CEILING + ", was " + maxDepth + ".");
        }
        this.registry = registry;
        this.matcher = matcher;
        this.invoker = invoker;
        this.maxDepth = maxDepth;
    }

    /**
     * Fully expands one compilation unit.
     *
     * @param unit The parsed unit.
     * @return A new unit without any call that matches a registered macro.
     * @throws MacroException if any expansion in the unit fails; the unit must not reach later phases.
     */
    public CompilationUnit expand(CompilationUnit unit) {
        LOG.debug("Expanding macros in {}", unit.fileName());
        List<AstNode> statements = expandStatements(unit.statements(), Scope.root(), 0, null);
        return new CompilationUnit(unit.fileName(), statements);
    }

    private List<AstNode> expandStatements(List<AstNode> statements, Scope scope, int depth, Captured captured) {
        List<AstNode> expanded = new ArrayList<>(statements.size());
        for (AstNode statement : statements) {
            AstNode result = expandNode(statement, scope, depth, true, captured);
            if (result == null) {
                continue;
            }
            if (result.kind() == NodeKind.DECLARATION) {
                scope.declare(((DeclarationNode) result).name(), result);
            }
            expanded.add(result);
        }
        return expanded;
    }

    /**
     * @return The expanded node, or {@code null} if a statement was deleted.
     */
    private AstNode expandNode(AstNode node, Scope scope, int depth, boolean statementPosition, Captured captured) {
        Captured origin = Captured.outermostHolding(captured, node);
        if (origin != null) {
            depth = origin.depth();
            captured = origin.outer();
        }
        if (node.kind() == NodeKind.CALL) {
            CallNode call = (CallNode) node;
            trace(ExpansionState.SCANNING, call, depth);
            MatchResult match = matcher.match(call, registry.lookup(call.callee()));
            if (match.isMatch()) {
                return expandCall(call, match.definition(), scope, depth, statementPosition, captured);
            }
        }
        return expandChildren(node, scope, depth, captured);
    }

    private AstNode expandCall(CallNode call, MacroDefinition definition, Scope scope, int depth,
                               boolean statementPosition, Captured captured) {
        trace(ExpansionState.MATCHED, call, depth);
        if (depth >= maxDepth) {
            trace(ExpansionState.ERROR, call, depth);
            throw new RecursionLimitException(definition.name(), call.span(), maxDepth);
        }

        trace(ExpansionState.INVOKING, call, depth);
        ReplacementResult result = invoker.invoke(definition, call, scope.snapshot());

        trace(ExpansionState.SUBSTITUTING, call, depth);
        if (result.isEmpty()) {
            if (!statementPosition) {
                trace(ExpansionState.ERROR, call, depth);
                throw new MacroExecutionException("Macro produced no replacement, but its call is used as a value.",
                        definition.name(), call.span(), null);
            }
            trace(ExpansionState.DONE, call, depth);
            return null;
        }

        AstNode replacement = result.node().orElseThrow();
        if (LOG.isTraceEnabled()) {
            LOG.trace("{} {} at {} (depth {}): {}", ExpansionState.RESCANNING, call.callee(), call.span(), depth,
                    AstPrinter.print(replacement));
        }
        AstNode rescanned = expandNode(replacement, scope, depth + 1, statementPosition,
                new Captured(subtreesOf(call.arguments()), depth, captured));
        trace(ExpansionState.DONE, call, depth);
        return rescanned;
    }

    private AstNode expandChildren(AstNode node, Scope scope, int depth, Captured captured) {
        if (node.kind() == NodeKind.LAMBDA) {
            LambdaNode lambda = (LambdaNode) node;
            Scope inner = scope.child();
            for (String parameter : lambda.parameters()) {
                inner.declare(parameter, lambda);
            }
            List<AstNode> body = expandStatements(lambda.body(), inner, depth, captured);
            return body.equals(lambda.body()) ? lambda : lambda.reconstructWithChildren(body);
        }

        List<AstNode> children = node.getChildren();
        if (children.isEmpty()) {
            return node;
        }
        List<AstNode> expanded = new ArrayList<>(children.size());
        boolean changed = false;
        for (AstNode child : children) {
            AstNode result = expandNode(child, scope, depth, false, captured);
            changed |= result != child;
            expanded.add(result);
        }
        return changed ? node.reconstructWithChildren(expanded) : node;
    }

    private static Set<AstNode> subtreesOf(List<AstNode> arguments) {
        Set<AstNode> nodes = Collections.newSetFromMap(new IdentityHashMap<>());
        List<AstNode> pending = new ArrayList<>(arguments);
        while (!pending.isEmpty()) {
            AstNode node = pending.remove(pending.size() - 1);
            if (nodes.add(node)) {
                pending.addAll(node.getChildren());
            }
        }
        return nodes;
    }

    private static void trace(ExpansionState state, CallNode call, int depth) {
        if (LOG.isTraceEnabled()) {
            LOG.trace("{} {} at {} (depth {})", state, call.callee(), call.span(), depth);
        }
    }

    /**
     * The argument subtrees of one expanded call, by identity, and the depth that call was expanded at.
     * Chained outwards through the calls whose results are being rescanned.
     */
    private record Captured(Set<AstNode> nodes, int depth, Captured outer) {

        static Captured outermostHolding(Captured innermost, AstNode node) {
            Captured found = null;
            for (Captured c = innermost; c != null; c = c.outer()) {
                if (c.nodes().contains(node)) {
                    found = c;
                }
            }
            return found;
        }
    }
}
