package org.macroweave.compiler.macro.spi;

import org.macroweave.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * The body of a macro: a function from the invocation context and the raw, unevaluated
 * argument nodes of the call site to a replacement.
 * <p>
 * Implementations run synchronously inside the expansion pass and must terminate on their own.
 * They must not keep the context or the argument nodes beyond the call.
 */
@FunctionalInterface
public interface MacroImplementation {

    /**
     * @param context The per-invocation context.
     * @param arguments The call-site argument nodes, in source order, matched against the signature.
     * @return The replacement for the call site; never {@code null}.
     */
    ReplacementResult expand(MacroContext context, List<AstNode> arguments);
}
