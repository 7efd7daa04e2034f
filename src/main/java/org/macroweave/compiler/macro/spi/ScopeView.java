package org.macroweave.compiler.macro.spi;

import org.macroweave.compiler.frontend.parser.ast.AstNode;

import java.util.Optional;
import java.util.Set;

/**
 * A read-only view of the syntactic scope enclosing a call site. Only names declared before
 * the call site are visible. Macros may look names up but cannot declare them.
 */
public interface ScopeView {

    /**
     * @param name A name.
     * @return {@code true} if the name is declared in this scope or an enclosing one.
     */
    boolean isDeclared(String name);

    /**
     * @param name A name.
     * @return The node that introduced the name: a {@code val} declaration or the lambda whose
     *         parameter it is. Inner scopes shadow outer ones.
     */
    Optional<AstNode> lookup(String name);

    /**
     * @return The names declared directly in this scope, in declaration order.
     */
    Set<String> localNames();

    /**
     * @return The enclosing scope, empty for the compilation unit scope.
     */
    Optional<ScopeView> parent();
}
