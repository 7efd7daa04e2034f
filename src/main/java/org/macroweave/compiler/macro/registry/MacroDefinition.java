package org.macroweave.compiler.macro.registry;

import org.macroweave.compiler.macro.spi.MacroImplementation;

import java.util.Objects;

/**
 * A registered macro: its signature, its implementation and where it came from.
 * Immutable; owned by the {@link MacroRegistry} for the lifetime of a compilation run.
 *
 * @param signature The signature call sites are matched against.
 * @param implementation The code run on a match.
 * @param origin A human-readable description of the providing library, used in diagnostics.
 */
public record MacroDefinition(
        MacroSignature signature,
        MacroImplementation implementation,
        String origin
) {

    public MacroDefinition {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(implementation, "implementation");
        origin = origin == null ? "<unknown>" : origin;
    }

    public String name() {
        return signature.name();
    }

    @Override
    public String toString() {
        return signature + " from " + origin;
    }
}
