package org.macroweave.compiler.macro.registry;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.macro.spi.MacroContext;
import org.macroweave.compiler.macro.spi.MacroImplementation;
import org.macroweave.compiler.macro.spi.MacroMethod;
import org.macroweave.compiler.macro.spi.ReplacementResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MacroRegistryTest {

    private static final MacroImplementation DELETE = (context, arguments) -> ReplacementResult.empty();

    private MacroRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new MacroRegistry();
    }

    @Test
    void register_keepsSameNameDefinitionsInRegistrationOrder() {
        // Arrange
        registry.register(MacroSignature.of("m", ParameterShape.LITERAL), DELETE);
        registry.register(MacroSignature.of("m", ParameterShape.ANY), DELETE);
        registry.register(MacroSignature.of("other"), DELETE);

        // Act & Assert
        assertThat(registry.signatures("m")).containsExactly(
                MacroSignature.of("m", ParameterShape.LITERAL),
                MacroSignature.of("m", ParameterShape.ANY));
        assertThat(registry.size()).isEqualTo(3);
        assertThat(registry.lookup("unknown")).isEmpty();
    }

    @Test
    void register_rejectsIdenticalSignature() {
        // Arrange
        registry.register(new MacroDefinition(MacroSignature.of("warn", ParameterShape.ANY, ParameterShape.ANY), DELETE, "first-lib"));

        // Act & Assert
        assertThatThrownBy(() -> registry.register(
                new MacroDefinition(MacroSignature.of("warn", ParameterShape.ANY, ParameterShape.ANY), DELETE, "second-lib")))
                .isInstanceOf(DuplicateSignatureException.class)
                .hasMessage("Macro signature warn(ANY, ANY) from second-lib is already registered by first-lib.")
                .satisfies(e -> assertThat(((DuplicateSignatureException) e).getCode()).isEqualTo(MacroErrorCode.DUPLICATE_SIGNATURE));
    }

    @Test
    void freeze_rejectsLaterRegistrationAndKeepsLookups() {
        // Arrange
        registry.register(MacroSignature.of("f", ParameterShape.LITERAL), DELETE);

        // Act
        MacroRegistry frozen = registry.freeze();

        // Assert
        assertThat(frozen).isSameAs(registry);
        assertThat(registry.isFrozen()).isTrue();
        assertThat(registry.lookup("f")).hasSize(1);
        assertThatThrownBy(() -> registry.register(MacroSignature.of("g"), DELETE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
    }

    @Test
    void lookup_returnsUnmodifiableSnapshot() {
        // Arrange
        registry.register(MacroSignature.of("f"), DELETE);

        // Act & Assert
        assertThatThrownBy(() -> registry.lookup("f").clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void registerLibrary_letsLibraryContributeDefinitions() {
        // Act
        registry.registerLibrary(target -> {
            target.register(MacroSignature.of("a"), DELETE);
            target.register(MacroSignature.of("b", ParameterShape.CALL), DELETE);
        });

        // Assert
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void registerAnnotated_registersTaggedMethods() {
        // Act
        registry.registerAnnotated(new TraceMacros());

        // Assert
        assertThat(registry.signatures("trace")).containsExactly(MacroSignature.of("trace", ParameterShape.ANY));
        assertThat(registry.lookup("trace").get(0).origin()).endsWith("TraceMacros#trace");
    }

    @Test
    void signature_rejectsBlankNameAndRendersShapes() {
        // Act & Assert
        assertThatThrownBy(() -> MacroSignature.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThat(MacroSignature.of("f", ParameterShape.LITERAL, ParameterShape.LAMBDA).arity()).isEqualTo(2);
        assertThat(MacroSignature.of("f")).hasToString("f()");
    }

    public static class TraceMacros {
        @MacroMethod
        public AstNode trace(MacroContext context, AstNode expression) {
            return expression;
        }
    }
}
