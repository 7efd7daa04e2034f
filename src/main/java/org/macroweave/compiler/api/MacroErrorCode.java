package org.macroweave.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during macro expansion.
 * This decouples the test logic from the wording of the error messages.
 */
public enum MacroErrorCode {
    // region Frontend Errors
    /** The lexer met a character or literal it could not tokenize. */
    LEXICAL_ERROR,
    /** The parser met a token sequence that is not a valid statement or expression. */
    SYNTAX_ERROR,
    // endregion

    // region Registration Errors
    /** An identical (name, shape sequence) pair was registered twice. */
    DUPLICATE_SIGNATURE,
    /** A macro library method could not be turned into a macro definition. */
    INVALID_DECLARATION,
    // endregion

    // region Expansion Errors
    /** A macro implementation failed or returned an unusable result. */
    MACRO_EXECUTION_FAILED,
    /** A template was materialized while one of its holes had no binding. */
    UNRESOLVED_HOLE,
    /** A template's source text could not be parsed. */
    TEMPLATE_SYNTAX,
    /** Recursive expansion exceeded the configured maximum depth. */
    RECURSION_LIMIT,
    // endregion

    // region General Errors
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
