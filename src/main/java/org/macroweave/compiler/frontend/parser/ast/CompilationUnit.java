package org.macroweave.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The parsed contents of one source file: its name and its top-level statements in order.
 *
 * @param fileName The logical file name.
 * @param statements The top-level statements.
 */
public record CompilationUnit(String fileName, List<AstNode> statements) {

    public CompilationUnit {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
