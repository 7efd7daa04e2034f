package org.macroweave.compiler.macro.registry;

import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.NodeKind;

/**
 * The structural shape a macro parameter requires of its call-site argument.
 * {@link #ANY} accepts every node; every other shape accepts exactly one {@link NodeKind}.
 * There is no widening between concrete shapes.
 */
public enum ParameterShape {
    ANY(null),
    LITERAL(NodeKind.LITERAL),
    IDENTIFIER(NodeKind.IDENTIFIER),
    LAMBDA(NodeKind.LAMBDA),
    CALL(NodeKind.CALL),
    BINARY_OP(NodeKind.BINARY_OP),
    UNARY_OP(NodeKind.UNARY_OP);

    private final NodeKind kind;

    ParameterShape(NodeKind kind) {
        this.kind = kind;
    }

    /**
     * @param argument A call-site argument node.
     * @return {@code true} if the argument has this shape.
     */
    public boolean matches(AstNode argument) {
        return argument != null && (this == ANY || argument.kind() == kind);
    }
}
