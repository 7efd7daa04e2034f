package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

/**
 * An AST node that represents a bare name.
 *
 * @param name The name.
 * @param span The source span.
 */
public record IdentifierNode(String name, SourceSpan span) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new IdentifierNode(name, span);
    }
}
