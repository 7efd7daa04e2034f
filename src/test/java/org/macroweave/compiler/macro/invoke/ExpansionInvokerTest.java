package org.macroweave.compiler.macro.invoke;

import com.typesafe.config.ConfigFactory;
import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.BinaryOpNode;
import org.macroweave.compiler.frontend.parser.ast.CallNode;
import org.macroweave.compiler.frontend.parser.ast.HoleNode;
import org.macroweave.compiler.frontend.parser.ast.IdentifierNode;
import org.macroweave.compiler.frontend.parser.ast.LiteralNode;
import org.macroweave.compiler.macro.expand.RecursionLimitException;
import org.macroweave.compiler.macro.registry.MacroDefinition;
import org.macroweave.compiler.macro.registry.MacroSignature;
import org.macroweave.compiler.macro.registry.ParameterShape;
import org.macroweave.compiler.macro.spi.CompileTimeConfig;
import org.macroweave.compiler.macro.spi.MacroContext;
import org.macroweave.compiler.macro.spi.MacroImplementation;
import org.macroweave.compiler.macro.spi.ReplacementResult;
import org.macroweave.compiler.macro.spi.ScopeView;
import org.macroweave.compiler.macro.template.Bindings;
import org.macroweave.compiler.macro.template.TemplateEngine;
import org.macroweave.compiler.macro.template.UnresolvedHoleException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the {@link ExpansionInvoker}, with the macro implementation and the enclosing
 * scope mocked.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ExpansionInvokerTest {

    private static final SourceSpan CALL_SPAN = new SourceSpan("main.mw", 7, 3, 7, 25);
    private static final SourceSpan ARGUMENT_SPAN = new SourceSpan("main.mw", 7, 8, 7, 10);

    @Mock
    private MacroImplementation implementation;

    @Mock
    private ScopeView scope;

    private CompileTimeConfig.Grant grant;
    private ExpansionInvoker invoker;
    private MacroDefinition definition;
    private CallNode callSite;

    @BeforeEach
    void setUp() {
        grant = CompileTimeConfig.grant(ConfigFactory.parseMap(Map.of("debug-warnings", true)));
        invoker = new ExpansionInvoker(new TemplateEngine(), grant.config());
        definition = new MacroDefinition(MacroSignature.of("twice", ParameterShape.ANY), implementation, "test");
        callSite = new CallNode("twice", List.of(new IdentifierNode("x", ARGUMENT_SPAN)), CALL_SPAN);
    }

    @AfterEach
    void tearDown() {
        grant.close();
    }

    @Test
    void invoke_passesContextAndRawArguments() {
        // Arrange
        when(implementation.expand(any(), anyList())).thenReturn(ReplacementResult.empty());
        ArgumentCaptor<MacroContext> context = ArgumentCaptor.forClass(MacroContext.class);

        // Act
        ReplacementResult result = invoker.invoke(definition, callSite, scope);

        // Assert
        assertThat(result.isEmpty()).isTrue();
        verify(implementation).expand(context.capture(), eq(callSite.arguments()));
        assertThat(context.getValue().macroName()).isEqualTo("twice");
        assertThat(context.getValue().callSite()).isEqualTo(CALL_SPAN);
        assertThat(context.getValue().locationString()).isEqualTo("main.mw:7:3");
        assertThat(context.getValue().enclosingScope()).isSameAs(scope);
        assertThat(context.getValue().config().getBoolean("debug-warnings")).isTrue();
    }

    @Test
    void invoke_locatesTemplateBornNodesAtCallSite() {
        // Arrange
        when(implementation.expand(any(), anyList())).thenAnswer(invocation -> {
            MacroContext context = invocation.getArgument(0);
            List<AstNode> arguments = invocation.getArgument(1);
            return ReplacementResult.of(context.quote("${x} * 2", Bindings.create().expression("x", arguments.get(0))));
        });

        // Act
        BinaryOpNode result = (BinaryOpNode) invoker.invoke(definition, callSite, scope).node().orElseThrow();

        // Assert
        assertThat(result.span()).isEqualTo(CALL_SPAN);
        assertThat(result.left().span()).isEqualTo(ARGUMENT_SPAN);
        assertThat(result.right().span()).isEqualTo(CALL_SPAN);
    }

    @Test
    void invoke_keepsDeliberatelySyntheticSpans() {
        // Arrange
        when(implementation.expand(any(), anyList()))
                .thenReturn(ReplacementResult.of(LiteralNode.ofInteger(0, SourceSpan.SYNTHETIC)));

        // Act
        AstNode result = invoker.invoke(definition, callSite, scope).node().orElseThrow();

        // Assert
        assertThat(result.span()).isEqualTo(SourceSpan.SYNTHETIC);
    }

    @Test
    void invoke_wrapsImplementationFailureWithMacroNameAndCallSite() {
        // Arrange
        when(implementation.expand(any(), anyList()))
                .thenThrow(new IllegalStateException("wrapper", new ArithmeticException("division by zero")));

        // Act & Assert
        assertThatThrownBy(() -> invoker.invoke(definition, callSite, scope))
                .isInstanceOf(MacroExecutionException.class)
                .hasMessage("Macro implementation failed: division by zero")
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> {
                    MacroExecutionException failure = (MacroExecutionException) e;
                    assertThat(failure.getMacroName()).isEqualTo("twice");
                    assertThat(failure.getSpan()).isEqualTo(CALL_SPAN);
                    assertThat(failure.getCode()).isEqualTo(MacroErrorCode.MACRO_EXECUTION_FAILED);
                });
    }

    @Test
    void invoke_treatsNullResultAsFailure() {
        // Arrange
        when(implementation.expand(any(), anyList())).thenReturn(null);

        // Act & Assert
        assertThatThrownBy(() -> invoker.invoke(definition, callSite, scope))
                .isInstanceOf(MacroExecutionException.class)
                .hasMessageContaining("returned null");
    }

    @Test
    void invoke_rejectsResultWithLeftoverHoles() {
        // Arrange
        when(implementation.expand(any(), anyList())).thenReturn(ReplacementResult.of(
                new HoleNode("body", HoleNode.HoleKind.EXPRESSION_SPLICE, SourceSpan.UNASSIGNED)));

        // Act & Assert
        assertThatThrownBy(() -> invoker.invoke(definition, callSite, scope))
                .isInstanceOf(UnresolvedHoleException.class)
                .satisfies(e -> {
                    UnresolvedHoleException unresolved = (UnresolvedHoleException) e;
                    assertThat(unresolved.getUnresolvedHoles()).containsExactly("body");
                    assertThat(unresolved.getMacroName()).isEqualTo("twice");
                    assertThat(unresolved.getSpan()).isEqualTo(CALL_SPAN);
                });
    }

    @Test
    void invoke_passesMacroExceptionsThroughWithTheirCategory() {
        // Arrange
        when(implementation.expand(any(), anyList())).thenAnswer(invocation -> {
            MacroContext context = invocation.getArgument(0);
            return ReplacementResult.of(context.quote("f(${missing})", Bindings.create()));
        });

        // Act & Assert
        assertThatThrownBy(() -> invoker.invoke(definition, callSite, scope))
                .isInstanceOf(UnresolvedHoleException.class)
                .satisfies(e -> assertThat(((UnresolvedHoleException) e).getSpan()).isEqualTo(CALL_SPAN));
    }

    @Test
    void invoke_keepsLocationAlreadyCarriedByMacroException() {
        // Arrange
        SourceSpan inner = new SourceSpan("lib.mw", 1, 1, 1, 1);
        when(implementation.expand(any(), anyList())).thenThrow(new RecursionLimitException("inner", inner, 3));

        // Act & Assert
        assertThatThrownBy(() -> invoker.invoke(definition, callSite, scope))
                .isInstanceOf(RecursionLimitException.class)
                .satisfies(e -> {
                    RecursionLimitException limit = (RecursionLimitException) e;
                    assertThat(limit.getMacroName()).isEqualTo("inner");
                    assertThat(limit.getSpan()).isEqualTo(inner);
                });
    }
}
