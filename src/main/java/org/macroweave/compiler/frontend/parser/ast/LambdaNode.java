package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents a lambda (closure) expression.
 *
 * @param parameters The parameter names, possibly empty.
 * @param body The statements of the body.
 * @param span The source span, from the opening to the closing brace.
 */
public record LambdaNode(
        List<String> parameters,
        List<AstNode> body,
        SourceSpan span
) implements AstNode {

    public LambdaNode {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAMBDA;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new LambdaNode(parameters, body, span);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new LambdaNode(parameters, newChildren, span);
    }
}
