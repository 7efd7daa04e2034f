package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents a call of a named callee. This is the node a call site is
 * made of: the callee name, the ordered, unevaluated argument nodes and the call's span.
 * A trailing lambda block is the last argument.
 *
 * @param callee The name of the called function or macro.
 * @param arguments The argument nodes, in source order.
 * @param span The source span of the whole call.
 */
public record CallNode(
        String callee,
        List<AstNode> arguments,
        SourceSpan span
) implements AstNode {

    /**
     * Compact constructor to ensure the argument list is never null and never shared.
     */
    public CallNode {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new CallNode(callee, arguments, span);
    }

    @Override
    public List<AstNode> getChildren() {
        return arguments;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new CallNode(callee, newChildren, span);
    }
}
