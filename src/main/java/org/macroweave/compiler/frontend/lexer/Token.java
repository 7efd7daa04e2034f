package org.macroweave.compiler.frontend.lexer;

import org.macroweave.compiler.api.SourceSpan;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENTIFIER, INTEGER, PLUS).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (e.g., the numeric value of a number, the unescaped string,
 *              or the hole name of a template hole).
 * @param line The line number where the token begins.
 * @param column The column number where the token begins.
 * @param endLine The line number of the last character of the token.
 * @param endColumn The column number of the last character of the token.
 * @param fileName The logical file name from which this token originates.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        int endLine,
        int endColumn,
        String fileName
) {

    /**
     * @return The source span this token covers.
     */
    public SourceSpan span() {
        return new SourceSpan(fileName, line, column, endLine, endColumn);
    }
}
