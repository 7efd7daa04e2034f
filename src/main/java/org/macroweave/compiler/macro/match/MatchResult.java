package org.macroweave.compiler.macro.match;

import org.macroweave.compiler.macro.registry.MacroDefinition;

import java.util.Objects;

/**
 * The outcome of matching one call site: either the chosen definition or no match.
 * No match is not an error; the call stays an ordinary call for later phases.
 */
public final class MatchResult {

    private static final MatchResult NO_MATCH = new MatchResult(null);

    private final MacroDefinition definition;

    private MatchResult(MacroDefinition definition) {
        this.definition = definition;
    }

    public static MatchResult matched(MacroDefinition definition) {
        return new MatchResult(Objects.requireNonNull(definition, "definition"));
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public boolean isMatch() {
        return definition != null;
    }

    /**
     * @return The matched definition.
     * @throws IllegalStateException if there was no match.
     */
    public MacroDefinition definition() {
        if (definition == null) {
            throw new IllegalStateException("No macro matched.");
        }
        return definition;
    }

    @Override
    public String toString() {
        return isMatch() ? "Matched[" + definition.signature() + "]" : "NoMatch";
    }
}
