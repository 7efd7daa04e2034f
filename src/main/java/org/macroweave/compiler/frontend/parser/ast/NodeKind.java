package org.macroweave.compiler.frontend.parser.ast;

/**
 * The closed set of syntactic node kinds. Every {@link AstNode} reports exactly one of these,
 * and structural matching is defined over this enumeration only. New syntax is added as a new
 * constant here together with its node record.
 */
public enum NodeKind {
    /** A literal constant: integer, float, string, boolean or null. */
    LITERAL,
    /** A bare name. */
    IDENTIFIER,
    /** A call of a named callee with ordered arguments. */
    CALL,
    /** A lambda (closure) expression with parameters and a statement body. */
    LAMBDA,
    /** An infix operator applied to two operands. */
    BINARY_OP,
    /** A prefix operator applied to one operand. */
    UNARY_OP,
    /** A {@code val name = expr} statement. */
    DECLARATION,
    /** A substitution hole; only present in template skeletons. */
    HOLE
}
