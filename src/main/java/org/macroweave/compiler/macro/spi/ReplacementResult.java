package org.macroweave.compiler.macro.spi;

import org.macroweave.compiler.frontend.parser.ast.AstNode;

import java.util.Objects;
import java.util.Optional;

/**
 * What a macro implementation returns: either a concrete node that replaces the call site,
 * or the explicit empty marker, which deletes the call site.
 */
public final class ReplacementResult {

    private static final ReplacementResult EMPTY = new ReplacementResult(null);

    private final AstNode node;

    private ReplacementResult(AstNode node) {
        this.node = node;
    }

    /**
     * @param node The replacement node; never {@code null}.
     * @return A result that substitutes {@code node} for the call site.
     */
    public static ReplacementResult of(AstNode node) {
        return new ReplacementResult(Objects.requireNonNull(node, "Replacement node must not be null; use ReplacementResult.empty() to delete the call."));
    }

    /**
     * @return The marker that removes the call site.
     */
    public static ReplacementResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return node == null;
    }

    public Optional<AstNode> node() {
        return Optional.ofNullable(node);
    }

    @Override
    public String toString() {
        return isEmpty() ? "ReplacementResult[empty]" : "ReplacementResult[" + node.kind() + "]";
    }
}
