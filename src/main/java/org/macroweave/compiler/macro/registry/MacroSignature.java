package org.macroweave.compiler.macro.registry;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The matchable part of a macro: its name and the ordered shapes of its parameters.
 * The context parameter is not part of the signature.
 *
 * @param name The macro name.
 * @param shapes The parameter shapes, in order.
 */
public record MacroSignature(String name, List<ParameterShape> shapes) {

    public MacroSignature {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Macro name must not be blank.");
        }
        shapes = List.copyOf(shapes);
    }

    /**
     * @param name The macro name.
     * @param shapes The parameter shapes, in order.
     * @return A new signature.
     */
    public static MacroSignature of(String name, ParameterShape... shapes) {
        return new MacroSignature(name, Arrays.asList(shapes));
    }

    /**
     * @return The number of call-site arguments this signature takes.
     */
    public int arity() {
        return shapes.size();
    }

    @Override
    public String toString() {
        return name + shapes.stream().map(Enum::name).collect(Collectors.joining(", ", "(", ")"));
    }
}
