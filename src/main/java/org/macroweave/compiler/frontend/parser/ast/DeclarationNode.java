package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents a {@code val name = initializer} statement.
 * The name is visible to the statements that follow it in the same block.
 *
 * @param name The declared name.
 * @param initializer The initializer expression.
 * @param span The source span of the whole statement.
 */
public record DeclarationNode(
        String name,
        AstNode initializer,
        SourceSpan span
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.DECLARATION;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new DeclarationNode(name, initializer, span);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(initializer);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new DeclarationNode(name, newChildren.get(0), span);
    }
}
