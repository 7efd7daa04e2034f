package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents a prefix operator expression such as {@code !x} or {@code -n}.
 *
 * @param operator The operator text.
 * @param operand The operand.
 * @param span The source span of the whole expression.
 */
public record UnaryOpNode(
        String operator,
        AstNode operand,
        SourceSpan span
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new UnaryOpNode(operator, operand, span);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new UnaryOpNode(operator, newChildren.get(0), span);
    }
}
