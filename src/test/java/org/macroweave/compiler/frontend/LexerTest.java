package org.macroweave.compiler.frontend;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.diagnostics.Diagnostic;
import org.macroweave.compiler.diagnostics.DiagnosticsEngine;
import org.macroweave.compiler.frontend.lexer.Lexer;
import org.macroweave.compiler.frontend.lexer.Token;
import org.macroweave.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text becomes the expected token stream, including positions,
 * literal values and template holes, and that malformed input is reported rather than thrown.
 */
public class LexerTest {

    /**
     * Verifies that a declaration with a call and a binary expression is tokenized with the
     * right types, texts and literal values.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        String source = "val limit = max(a, 42) >= 1.5 // trailing comment";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer(source, diagnostics, "main.mw").scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VAL, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.IDENTIFIER, TokenType.LEFT_PAREN,
                TokenType.IDENTIFIER, TokenType.COMMA, TokenType.INTEGER, TokenType.RIGHT_PAREN,
                TokenType.GREATER_EQUAL, TokenType.FLOAT, TokenType.END_OF_FILE);
        assertThat(tokens.get(7)).extracting(Token::text, Token::value).containsExactly("42", 42L);
        assertThat(tokens.get(10).value()).isEqualTo(1.5);
    }

    /**
     * Verifies that every token records its file, start and end position, across lines.
     */
    @Test
    @Tag("unit")
    void testTokenPositions() {
        // Arrange
        String source = "a\n  foo(1)";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer(source, diagnostics, "pos.mw").scanTokens();

        // Assert
        Token foo = tokens.get(2);
        assertThat(foo.text()).isEqualTo("foo");
        assertThat(foo.fileName()).isEqualTo("pos.mw");
        assertThat(foo.line()).isEqualTo(2);
        assertThat(foo.column()).isEqualTo(3);
        assertThat(foo.endColumn()).isEqualTo(5);
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.NEWLINE);
    }

    /**
     * Verifies hexadecimal and binary integer literals, and string escapes.
     */
    @Test
    @Tag("unit")
    void testNumberPrefixesAndStringEscapes() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("0xFF 0b101 \"a\\n\\\"b\\\"\"", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).value()).isEqualTo(255L);
        assertThat(tokens.get(1).value()).isEqualTo(5L);
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.STRING, "a\n\"b\"");
    }

    /**
     * Verifies that both kinds of template holes become dedicated tokens whose value is the hole name.
     */
    @Test
    @Tag("unit")
    void testTemplateHoles() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("${cond} && #{location}", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.EXPRESSION_HOLE, "cond");
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.AND_AND);
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.VALUE_HOLE, "location");
    }

    /**
     * Verifies that lexical errors are reported with their position and that scanning continues.
     */
    @Test
    @Tag("unit")
    void testLexicalErrorsAreReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("a @ b\n\"open", diagnostics, "bad.mw").scanTokens();

        // Assert
        assertThat(diagnostics.getDiagnostics()).hasSize(2);
        assertThat(diagnostics.getDiagnostics().get(0))
                .extracting(Diagnostic::code, Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly(MacroErrorCode.LEXICAL_ERROR, 1, 3);
        assertThat(diagnostics.getDiagnostics().get(1).message()).contains("Unterminated string");
        assertThat(tokens).extracting(Token::text).contains("a", "b");
    }
}
