package org.macroweave.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders an AST back into canonical source text. The output parses back into a structurally
 * identical tree: parentheses are emitted exactly where operator precedence requires them.
 */
public final class AstPrinter {

    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
            Map.entry("||", 1),
            Map.entry("&&", 2),
            Map.entry("==", 3), Map.entry("!=", 3),
            Map.entry("<", 4), Map.entry("<=", 4), Map.entry(">", 4), Map.entry(">=", 4),
            Map.entry("+", 5), Map.entry("-", 5),
            Map.entry("*", 6), Map.entry("/", 6), Map.entry("%", 6)
    );

    private AstPrinter() {}

    /**
     * Renders a single node.
     * @param node The node to render.
     * @return The canonical source text.
     */
    public static String print(AstNode node) {
        if (node == null) {
            return "";
        }
        switch (node.kind()) {
            case LITERAL:
                return literal((LiteralNode) node);
            case IDENTIFIER:
                return ((IdentifierNode) node).name();
            case CALL: {
                CallNode call = (CallNode) node;
                return call.callee() + "(" + join(call.arguments(), ", ") + ")";
            }
            case LAMBDA: {
                LambdaNode lambda = (LambdaNode) node;
                if (lambda.parameters().isEmpty() && lambda.body().isEmpty()) {
                    return "{}";
                }
                String params = lambda.parameters().isEmpty() ? "" : String.join(", ", lambda.parameters()) + " -> ";
                return "{ " + params + join(lambda.body(), "; ") + " }";
            }
            case BINARY_OP: {
                BinaryOpNode binary = (BinaryOpNode) node;
                int precedence = precedenceOf(binary);
                String left = operand(binary.left(), precedence, false);
                String right = operand(binary.right(), precedence, true);
                return left + " " + binary.operator() + " " + right;
            }
            case UNARY_OP: {
                UnaryOpNode unary = (UnaryOpNode) node;
                String operand = print(unary.operand());
                if (unary.operand().kind() == NodeKind.BINARY_OP) {
                    operand = "(" + operand + ")";
                }
                return unary.operator() + operand;
            }
            case DECLARATION: {
                DeclarationNode declaration = (DeclarationNode) node;
                return "val " + declaration.name() + " = " + print(declaration.initializer());
            }
            case HOLE: {
                HoleNode hole = (HoleNode) node;
                String sigil = hole.holeKind() == HoleNode.HoleKind.EXPRESSION_SPLICE ? "$" : "#";
                return sigil + "{" + hole.name() + "}";
            }
            default:
                throw new IllegalStateException("Unhandled node kind: " + node.kind());
        }
    }

    /**
     * Renders all statements of a compilation unit, one per line.
     * @param unit The unit to render.
     * @return The canonical source text of the unit.
     */
    public static String print(CompilationUnit unit) {
        return unit.statements().stream().map(AstPrinter::print).collect(Collectors.joining("\n"));
    }

    private static String operand(AstNode operand, int parentPrecedence, boolean rightSide) {
        String text = print(operand);
        if (operand.kind() != NodeKind.BINARY_OP) {
            return text;
        }
        int precedence = precedenceOf((BinaryOpNode) operand);
        // Operators are left-associative: an equal-precedence right operand needs parentheses.
        boolean needsParens = rightSide ? precedence <= parentPrecedence : precedence < parentPrecedence;
        return needsParens ? "(" + text + ")" : text;
    }

    private static int precedenceOf(BinaryOpNode node) {
        return PRECEDENCE.getOrDefault(node.operator(), 0);
    }

    private static String literal(LiteralNode literal) {
        switch (literal.literalType()) {
            case STRING:
                return "\"" + escape((String) literal.value()) + "\"";
            case NULL:
                return "null";
            default:
                return String.valueOf(literal.value());
        }
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\t", "\\t");
    }

    private static String join(List<AstNode> nodes, String separator) {
        return nodes.stream().map(AstPrinter::print).collect(Collectors.joining(separator));
    }
}
