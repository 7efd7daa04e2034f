package org.macroweave.compiler.frontend.lexer;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * Errors are reported to the {@link DiagnosticsEngine}; scanning always continues.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "null", TokenType.NULL,
            "val", TokenType.VAL
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting and spans.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '-': addToken(match('>') ? TokenType.ARROW : TokenType.MINUS); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) {
                    addToken(TokenType.AND_AND);
                } else {
                    error("Unexpected character: &");
                }
                break;
            case '|':
                if (match('|')) {
                    addToken(TokenType.OR_OR);
                } else {
                    error("Unexpected character: |");
                }
                break;
            case '/':
                if (match('/')) {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '$': hole(TokenType.EXPRESSION_HOLE); break;
            case '#': hole(TokenType.VALUE_HOLE); break;
            case '"': string(); break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                column = 1;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void hole(TokenType type) {
        if (!match('{')) {
            error("Expected '{' after '" + source.charAt(start) + "' in template hole.");
            return;
        }
        int nameStart = current;
        while (isAlphaNumeric(peek())) advance();
        String name = source.substring(nameStart, current);
        if (name.isEmpty() || !isAlpha(name.charAt(0))) {
            error("Template hole needs a name.");
            return;
        }
        if (!match('}')) {
            error("Unterminated template hole '" + name + "'.");
            return;
        }
        addToken(type, name);
    }

    private void number() {
        // Recognize hex/binary prefixes right at the start of a number
        if (previous() == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'b' || peek() == 'B')) {
            advance(); // consume 'x' or 'b'
            while (isAlphaNumeric(peek())) advance();
            integer(source.substring(start, current));
            return;
        }

        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            addToken(TokenType.FLOAT, Double.parseDouble(text));
            return;
        }
        integer(source.substring(start, current));
    }

    private void integer(String numberString) {
        try {
            addToken(TokenType.INTEGER, parseLong(numberString));
        } catch (NumberFormatException e) {
            error("Invalid number format: " + numberString);
        }
    }

    private long parseLong(String token) {
        String s = token;
        int radix = 10;
        if (s.startsWith("0b") || s.startsWith("0B")) {
            radix = 2;
            s = s.substring(2);
        } else if (s.startsWith("0x") || s.startsWith("0X")) {
            radix = 16;
            s = s.substring(2);
        }
        if (s.isEmpty()) throw new NumberFormatException("Empty numeric literal");
        return Long.parseLong(s, radix);
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                line++;
                column = 1;
            }
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    default -> {
                        error("Unknown escape sequence: \\" + escaped);
                        value.append(escaped);
                    }
                }
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            error("Unterminated string.");
            return;
        }

        // The closing "
        advance();

        // The text of the token is the string *with* quotes, the value is the unescaped content.
        addToken(TokenType.STRING, value.toString());
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        // The column counter already points past the last character.
        tokens.add(new Token(type, text, literal, startLine, startColumn, line, Math.max(startColumn, column - 1), logicalFileName));
    }

    private void error(String message) {
        diagnostics.reportError(MacroErrorCode.LEXICAL_ERROR, message, logicalFileName, startLine, startColumn);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        if (current == 0) return '\0';
        return source.charAt(current - 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
