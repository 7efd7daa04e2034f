package org.macroweave.compiler.frontend.lexer;

/**
 * Defines all possible token types that the {@link Lexer} can produce.
 */
public enum TokenType {
    // Literals and names
    IDENTIFIER, INTEGER, FLOAT, STRING,

    // Keywords
    TRUE, FALSE, NULL, VAL,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, COMMA, SEMICOLON, ARROW,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Template holes: ${name} and #{name}
    EXPRESSION_HOLE, VALUE_HOLE,

    // Special
    NEWLINE, END_OF_FILE
}
