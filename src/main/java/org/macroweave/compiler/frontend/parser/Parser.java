package org.macroweave.compiler.frontend.parser;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.diagnostics.DiagnosticsEngine;
import org.macroweave.compiler.frontend.lexer.Token;
import org.macroweave.compiler.frontend.lexer.TokenType;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.BinaryOpNode;
import org.macroweave.compiler.frontend.parser.ast.CallNode;
import org.macroweave.compiler.frontend.parser.ast.CompilationUnit;
import org.macroweave.compiler.frontend.parser.ast.DeclarationNode;
import org.macroweave.compiler.frontend.parser.ast.HoleNode;
import org.macroweave.compiler.frontend.parser.ast.IdentifierNode;
import org.macroweave.compiler.frontend.parser.ast.LambdaNode;
import org.macroweave.compiler.frontend.parser.ast.LiteralNode;
import org.macroweave.compiler.frontend.parser.ast.UnaryOpNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The parser for the host expression language. It consumes a list of tokens
 * from the {@link org.macroweave.compiler.frontend.lexer.Lexer} and produces a {@link CompilationUnit}.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine}; after an error the parser skips to the
 * next statement separator and continues, so one run reports as many errors as possible.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final boolean templateMode;
    private int current = 0;

    /**
     * Constructs a new Parser for ordinary source code. Template holes are rejected.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param fileName The logical name of the file being parsed.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName) {
        this(tokens, diagnostics, fileName, false);
    }

    private Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName, boolean templateMode) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
        this.templateMode = templateMode;
    }

    /**
     * Creates a parser that accepts {@code ${name}} and {@code #{name}} holes in expression position.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors.
     * @param fileName The logical name of the template, for diagnostics.
     * @return A parser in template mode.
     */
    public static Parser forTemplate(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName) {
        return new Parser(tokens, diagnostics, fileName, true);
    }

    /**
     * Parses the entire token stream.
     * @return The compilation unit holding every statement that parsed successfully.
     */
    public CompilationUnit parse() {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
                continue;
            }
            AstNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return new CompilationUnit(fileName, statements);
    }

    /**
     * Parses a single top-level statement and recovers from errors.
     * @return The parsed {@link AstNode}, or null if an error occurs.
     */
    public AstNode declaration() {
        try {
            AstNode statement = statement();
            expectStatementEnd();
            return statement;
        } catch (ParseError ex) {
            synchronize();
            return null;
        }
    }

    private AstNode statement() {
        if (match(TokenType.VAL)) {
            Token valToken = previous();
            Token name = consume(TokenType.IDENTIFIER, "Expected name after 'val'.");
            consume(TokenType.EQUAL, "Expected '=' after declared name.");
            skipNewlines();
            AstNode initializer = expression();
            return new DeclarationNode(name.text(), initializer, SourceSpan.covering(valToken.span(), initializer.span()));
        }
        return expression();
    }

    private void expectStatementEnd() {
        if (isAtEnd() || check(TokenType.RIGHT_BRACE)) {
            return;
        }
        if (!match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
            throw error(peek(), "Expected end of statement, but got '" + peek().text() + "'.");
        }
    }

    /**
     * Parses an expression.
     * @return The parsed expression node.
     */
    public AstNode expression() {
        return or();
    }

    private AstNode or() {
        AstNode expr = and();
        while (match(TokenType.OR_OR)) {
            expr = binary(expr, previous(), and());
        }
        return expr;
    }

    private AstNode and() {
        AstNode expr = equality();
        while (match(TokenType.AND_AND)) {
            expr = binary(expr, previous(), equality());
        }
        return expr;
    }

    private AstNode equality() {
        AstNode expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            expr = binary(expr, previous(), comparison());
        }
        return expr;
    }

    private AstNode comparison() {
        AstNode expr = term();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            expr = binary(expr, previous(), term());
        }
        return expr;
    }

    private AstNode term() {
        AstNode expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            expr = binary(expr, previous(), factor());
        }
        return expr;
    }

    private AstNode factor() {
        AstNode expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            expr = binary(expr, previous(), unary());
        }
        return expr;
    }

    private AstNode binary(AstNode left, Token operator, AstNode right) {
        return new BinaryOpNode(operator.text(), left, right, SourceSpan.covering(left.span(), right.span()));
    }

    private AstNode unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token operator = previous();
            AstNode operand = unary();
            return new UnaryOpNode(operator.text(), operand, SourceSpan.covering(operator.span(), operand.span()));
        }
        return primary();
    }

    private AstNode primary() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER:
                advance();
                return LiteralNode.ofInteger((Long) token.value(), token.span());
            case FLOAT:
                advance();
                return LiteralNode.ofFloat((Double) token.value(), token.span());
            case STRING:
                advance();
                return LiteralNode.ofString((String) token.value(), token.span());
            case TRUE:
                advance();
                return LiteralNode.ofBoolean(true, token.span());
            case FALSE:
                advance();
                return LiteralNode.ofBoolean(false, token.span());
            case NULL:
                advance();
                return LiteralNode.ofNull(token.span());
            case IDENTIFIER:
                advance();
                return callOrIdentifier(token);
            case LEFT_PAREN: {
                advance();
                skipNewlines();
                AstNode inner = expression();
                skipNewlines();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
                return inner;
            }
            case LEFT_BRACE:
                return lambda();
            case EXPRESSION_HOLE:
            case VALUE_HOLE:
                return hole(token);
            default:
                throw error(token, "Expected expression, but got '" + describe(token) + "'.");
        }
    }

    private AstNode callOrIdentifier(Token name) {
        if (!check(TokenType.LEFT_PAREN) && !check(TokenType.LEFT_BRACE)) {
            return new IdentifierNode(name.text(), name.span());
        }

        List<AstNode> arguments = new ArrayList<>();
        SourceSpan end = name.span();
        if (match(TokenType.LEFT_PAREN)) {
            skipNewlines();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    skipNewlines();
                    arguments.add(expression());
                    skipNewlines();
                } while (match(TokenType.COMMA));
            }
            end = consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.").span();
        }
        // A block directly after the callee (or its argument list) is a trailing lambda argument.
        if (check(TokenType.LEFT_BRACE)) {
            AstNode trailing = lambda();
            arguments.add(trailing);
            end = trailing.span();
        }
        return new CallNode(name.text(), arguments, SourceSpan.covering(name.span(), end));
    }

    private AstNode lambda() {
        Token open = consume(TokenType.LEFT_BRACE, "Expected '{'.");
        skipNewlines();

        List<String> parameters = new ArrayList<>();
        if (hasParameterList()) {
            do {
                skipNewlines();
                parameters.add(consume(TokenType.IDENTIFIER, "Expected parameter name.").text());
            } while (match(TokenType.COMMA));
            consume(TokenType.ARROW, "Expected '->' after lambda parameters.");
        }

        List<AstNode> body = new ArrayList<>();
        while (true) {
            while (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
                // skip blank separators
            }
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) {
                break;
            }
            body.add(statement());
            expectStatementEnd();
        }
        Token close = consume(TokenType.RIGHT_BRACE, "Expected '}' to close lambda.");
        return new LambdaNode(parameters, body, SourceSpan.covering(open.span(), close.span()));
    }

    private boolean hasParameterList() {
        int i = current;
        if (tokens.get(i).type() != TokenType.IDENTIFIER) {
            return false;
        }
        i++;
        while (i + 1 < tokens.size() && tokens.get(i).type() == TokenType.COMMA
                && tokens.get(i + 1).type() == TokenType.IDENTIFIER) {
            i += 2;
        }
        return i < tokens.size() && tokens.get(i).type() == TokenType.ARROW;
    }

    private AstNode hole(Token token) {
        if (!templateMode) {
            throw error(token, "Template hole '" + token.text() + "' is only allowed inside a template.");
        }
        advance();
        HoleNode.HoleKind kind = token.type() == TokenType.EXPRESSION_HOLE
                ? HoleNode.HoleKind.EXPRESSION_SPLICE
                : HoleNode.HoleKind.VALUE_SPLICE;
        return new HoleNode((String) token.value(), kind, token.span());
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private void synchronize() {
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
                return;
            }
            advance();
        }
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(MacroErrorCode.SYNTAX_ERROR, message, token.fileName(), token.line(), token.column());
        return new ParseError(message);
    }

    private static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of file" : token.type() == TokenType.NEWLINE ? "end of line" : token.text();
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        if (current == 0) return null;
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return current >= tokens.size() || tokens.get(current).type() == TokenType.END_OF_FILE;
    }

    /**
     * Unwinds the parser to the enclosing statement after an error was reported.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
