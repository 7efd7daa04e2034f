package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

/**
 * An AST node that represents a literal constant.
 *
 * @param literalType The type of the constant.
 * @param value The constant: a {@link Long}, {@link Double}, {@link String}, {@link Boolean}, or {@code null}.
 * @param span The source span.
 */
public record LiteralNode(
        LiteralType literalType,
        Object value,
        SourceSpan span
) implements AstNode {

    /**
     * The type of a literal constant.
     */
    public enum LiteralType { INTEGER, FLOAT, STRING, BOOLEAN, NULL }

    public static LiteralNode ofInteger(long value, SourceSpan span) {
        return new LiteralNode(LiteralType.INTEGER, value, span);
    }

    public static LiteralNode ofFloat(double value, SourceSpan span) {
        return new LiteralNode(LiteralType.FLOAT, value, span);
    }

    public static LiteralNode ofString(String value, SourceSpan span) {
        return new LiteralNode(LiteralType.STRING, value, span);
    }

    public static LiteralNode ofBoolean(boolean value, SourceSpan span) {
        return new LiteralNode(LiteralType.BOOLEAN, value, span);
    }

    public static LiteralNode ofNull(SourceSpan span) {
        return new LiteralNode(LiteralType.NULL, null, span);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new LiteralNode(literalType, value, span);
    }

    // This node has no children and inherits the empty list from getChildren().
}
