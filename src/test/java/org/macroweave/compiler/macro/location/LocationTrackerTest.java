package org.macroweave.compiler.macro.location;

import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.BinaryOpNode;
import org.macroweave.compiler.frontend.parser.ast.IdentifierNode;
import org.macroweave.compiler.frontend.parser.ast.LiteralNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LocationTrackerTest {

    private static final SourceSpan CALL_SITE = new SourceSpan("main.mw", 3, 5, 3, 22);
    private static final SourceSpan ARGUMENT = new SourceSpan("main.mw", 3, 10, 3, 12);

    @Test
    void propagate_assignsCallSiteOnlyToUnassignedNodes() {
        // Arrange
        IdentifierNode captured = new IdentifierNode("age", ARGUMENT);
        LiteralNode synthetic = LiteralNode.ofInteger(1, SourceSpan.SYNTHETIC);
        AstNode templateBorn = new BinaryOpNode("+", captured, synthetic, SourceSpan.UNASSIGNED);

        // Act
        BinaryOpNode located = (BinaryOpNode) LocationTracker.propagate(templateBorn, CALL_SITE);

        // Assert
        assertThat(LocationTracker.locate(located)).isEqualTo(CALL_SITE);
        assertThat(located.left().span()).isEqualTo(ARGUMENT);
        assertThat(located.right().span()).isEqualTo(SourceSpan.SYNTHETIC);
    }

    @Test
    void unassign_marksEveryNodeAsUnlocated() {
        // Arrange
        AstNode node = new BinaryOpNode("+", new IdentifierNode("a", ARGUMENT), new IdentifierNode("b", ARGUMENT), CALL_SITE);

        // Act
        BinaryOpNode unassigned = (BinaryOpNode) LocationTracker.unassign(node);

        // Assert
        assertThat(unassigned.span()).isEqualTo(SourceSpan.UNASSIGNED);
        assertThat(unassigned.left().span().isLocated()).isFalse();
        assertThat(unassigned.right().span().isLocated()).isFalse();
    }

    @Test
    void sameStructure_ignoresSpansButNotShape() {
        // Arrange
        AstNode a = new BinaryOpNode("+", new IdentifierNode("x", ARGUMENT), LiteralNode.ofInteger(1, ARGUMENT), CALL_SITE);
        AstNode b = new BinaryOpNode("+", new IdentifierNode("x", SourceSpan.SYNTHETIC), LiteralNode.ofInteger(1, CALL_SITE), ARGUMENT);
        AstNode c = new BinaryOpNode("-", new IdentifierNode("x", ARGUMENT), LiteralNode.ofInteger(1, ARGUMENT), CALL_SITE);

        // Act & Assert
        assertThat(LocationTracker.sameStructure(a, b)).isTrue();
        assertThat(LocationTracker.sameStructure(a, c)).isFalse();
        assertThat(LocationTracker.sameStructure(a, null)).isFalse();
    }

    @Test
    void sourceSpan_rendersFileLineAndColumn() {
        // Act & Assert
        assertThat(CALL_SITE.toString()).isEqualTo("main.mw:3:5");
        assertThat(CALL_SITE.isLocated()).isTrue();
        assertThat(SourceSpan.covering(ARGUMENT, CALL_SITE)).isEqualTo(new SourceSpan("main.mw", 3, 10, 3, 22));
    }
}
