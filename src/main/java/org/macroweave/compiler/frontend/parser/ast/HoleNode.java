package org.macroweave.compiler.frontend.parser.ast;

import org.macroweave.compiler.api.SourceSpan;

/**
 * A named substitution hole in a template skeleton. Holes never survive materialization.
 *
 * @param name The hole name.
 * @param holeKind Whether the hole takes a captured subtree or a computed value.
 * @param span The position of the hole in the template source.
 */
public record HoleNode(
        String name,
        HoleKind holeKind,
        SourceSpan span
) implements AstNode {

    /**
     * The two kinds of template holes.
     */
    public enum HoleKind {
        /** {@code ${name}}: embeds a previously captured subtree unchanged. */
        EXPRESSION_SPLICE,
        /** {@code #{name}}: embeds a computed scalar or string as a literal node. */
        VALUE_SPLICE
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HOLE;
    }

    @Override
    public AstNode withSpan(SourceSpan span) {
        return new HoleNode(name, holeKind, span);
    }
}
