package org.macroweave.compiler.macro.template;

import org.macroweave.compiler.frontend.parser.ast.AstNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The values for the holes of a template: captured subtrees for expression splices and
 * plain Java values for value splices. A value binding may be {@code null}; it becomes a
 * {@code null} literal.
 */
public final class Bindings {

    private final Map<String, AstNode> expressions = new LinkedHashMap<>();
    private final Map<String, Object> values = new HashMap<>();

    private Bindings() {}

    /**
     * @return An empty set of bindings.
     */
    public static Bindings create() {
        return new Bindings();
    }

    /**
     * Binds an expression splice {@code ${name}}.
     * @param name The hole name.
     * @param subtree The subtree to embed unchanged.
     * @return this
     */
    public Bindings expression(String name, AstNode subtree) {
        expressions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(subtree, "subtree"));
        return this;
    }

    /**
     * Binds a value splice {@code #{name}}.
     * @param name The hole name.
     * @param value The scalar or string to embed as a literal; may be {@code null}.
     * @return this
     */
    public Bindings value(String name, Object value) {
        values.put(Objects.requireNonNull(name, "name"), value);
        return this;
    }

    public Map<String, AstNode> expressions() {
        return Collections.unmodifiableMap(expressions);
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }
}
