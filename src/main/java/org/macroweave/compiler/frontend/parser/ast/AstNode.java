package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable; every change produces a new node.
 */
public interface AstNode {

    /**
     * @return The structural kind of this node.
     */
    NodeKind kind();

    /**
     * @return The source span this node was parsed from, or one of the marker spans.
     */
    SourceSpan span();

    /**
     * Creates a copy of this node carrying a different span. Children keep their own spans.
     *
     * @param span The new span.
     * @return A new node equal to this one except for its span.
     */
    AstNode withSpan(SourceSpan span);

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children.
     * This allows the TreeWalker to reconstruct nodes generically without
     * knowing their specific types.
     *
     * @param newChildren The new children for this node, in {@link #getChildren()} order.
     * @return A new instance of this node with the new children, or this node if it has none.
     */
    default AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return this;
    }
}
