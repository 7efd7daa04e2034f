package org.macroweave.compiler.macro.expand;

import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.macro.spi.ScopeView;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A syntactic scope the driver builds while walking a unit: the unit itself, and one per lambda.
 * Macros only ever see a {@link #snapshot()} of it, through {@link ScopeView}.
 */
final class Scope implements ScopeView {

    private final Scope parent;
    private final Map<String, AstNode> declarations = new LinkedHashMap<>();

    private Scope(Scope parent) {
        this.parent = parent;
    }

    static Scope root() {
        return new Scope(null);
    }

    Scope child() {
        return new Scope(this);
    }

    /**
     * @return A copy of this scope chain that later declarations do not change.
     */
    Scope snapshot() {
        Scope copy = new Scope(parent == null ? null : parent.snapshot());
        copy.declarations.putAll(declarations);
        return copy;
    }

    void declare(String name, AstNode introducedBy) {
        declarations.put(name, introducedBy);
    }

    @Override
    public boolean isDeclared(String name) {
        return lookup(name).isPresent();
    }

    @Override
    public Optional<AstNode> lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            AstNode node = scope.declarations.get(name);
            if (node != null) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    @Override
    public Set<String> localNames() {
        return Collections.unmodifiableSet(declarations.keySet());
    }

    @Override
    public Optional<ScopeView> parent() {
        return Optional.ofNullable(parent);
    }
}
