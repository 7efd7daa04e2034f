package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents an infix operator expression such as {@code a + b} or {@code x && y}.
 *
 * @param operator The operator text.
 * @param left The left operand.
 * @param right The right operand.
 * @param span The source span of the whole expression.
 */
public record BinaryOpNode(
        String operator,
        AstNode left,
        AstNode right,
        SourceSpan span
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new BinaryOpNode(operator, left, right, span);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new BinaryOpNode(operator, newChildren.get(0), newChildren.get(1), span);
    }
}
