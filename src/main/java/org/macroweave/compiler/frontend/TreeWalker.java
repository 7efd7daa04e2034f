package org.macroweave.compiler.frontend;

import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.NodeKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system keyed by
 * {@link NodeKind} to minimize coupling between compiler phases and the AST structure.
 */
public class TreeWalker {

    private final Map<NodeKind, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node kinds to their corresponding handlers.
     */
    public TreeWalker(Map<NodeKind, Consumer<AstNode>> handlers) {
        this.handlers = new EnumMap<>(NodeKind.class);
        this.handlers.putAll(handlers);
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively, pre-order.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.kind(), n -> {}).accept(node);

        // Descend recursively into ALL children without knowing their type.
        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Transforms an AST bottom-up. Children are transformed first; a node whose children all
     * came back unchanged is passed to {@code rewrite} as-is, otherwise it is reconstructed first.
     * Subtrees that are not touched keep their identity.
     *
     * @param node The root node to transform.
     * @param rewrite Called once per node after its children were transformed.
     * @return The transformed node (may be the same instance).
     */
    public static AstNode transform(AstNode node, UnaryOperator<AstNode> rewrite) {
        if (node == null) {
            return null;
        }

        List<AstNode> children = node.getChildren();
        List<AstNode> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (AstNode child : children) {
            AstNode transformedChild = transform(child, rewrite);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        AstNode current = childrenChanged ? node.reconstructWithChildren(transformedChildren) : node;
        return rewrite.apply(current);
    }
}
