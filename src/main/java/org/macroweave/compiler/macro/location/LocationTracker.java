package org.macroweave.compiler.macro.location;

import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.frontend.TreeWalker;
import org.macroweave.compiler.frontend.parser.ast.AstNode;

import java.util.Objects;

/**
 * Reads and propagates source spans on AST nodes.
 * <p>
 * Spans are assigned once: by the parser for source code, or by {@link #propagate} for nodes a
 * macro expansion introduced. A node whose span is {@link SourceSpan#UNASSIGNED} has not been
 * located yet; {@link SourceSpan#SYNTHETIC} marks a node a macro deliberately built without a
 * location, and is never overwritten.
 */
public final class LocationTracker {

    private LocationTracker() {}

    /**
     * @param node The node to locate.
     * @return The node's span.
     */
    public static SourceSpan locate(AstNode node) {
        return Objects.requireNonNull(node, "node").span();
    }

    /**
     * Assigns {@code callSite} to every {@link SourceSpan#UNASSIGNED} node in the tree.
     * Parsed subtrees (captured arguments) and synthetic nodes keep their spans.
     *
     * @param node The root of an expansion result.
     * @param callSite The span of the call site that produced it.
     * @return The located tree.
     */
    public static AstNode propagate(AstNode node, SourceSpan callSite) {
        return TreeWalker.transform(node, n -> SourceSpan.UNASSIGNED.equals(n.span()) ? n.withSpan(callSite) : n);
    }

    /**
     * Resets every span in the tree to {@link SourceSpan#UNASSIGNED}. Used for template skeletons,
     * whose nodes must take the location of the call site they are materialized for.
     *
     * @param node The root node.
     * @return The same tree with no locations.
     */
    public static AstNode unassign(AstNode node) {
        return TreeWalker.transform(node, n -> n.withSpan(SourceSpan.UNASSIGNED));
    }

    /**
     * Replaces every span in the tree by {@link SourceSpan#SYNTHETIC}.
     *
     * @param node The root node.
     * @return A location-free copy, suitable for structural comparison with {@code equals}.
     */
    public static AstNode stripLocations(AstNode node) {
        return TreeWalker.transform(node, n -> n.withSpan(SourceSpan.SYNTHETIC));
    }

    /**
     * Compares two trees by structure only, ignoring every span.
     *
     * @param a The first tree.
     * @param b The second tree.
     * @return {@code true} if both trees have the same kinds, payloads and shape.
     */
    public static boolean sameStructure(AstNode a, AstNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        return stripLocations(a).equals(stripLocations(b));
    }
}
