package org.jackc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The body of a subroutine: all {@code var} declarations come before the statements.
 *
 * @param varDecs The local variable declarations.
 * @param statements The statements.
 */
public record SubroutineBodyNode(List<VarDecNode> varDecs, List<StatementNode> statements) implements AstNode {

    public SubroutineBodyNode {
        varDecs = List.copyOf(varDecs);
        statements = List.copyOf(statements);
    }

    /**
     * @return The total number of local variable names across all declarations.
     */
    public int localCount() {
        return varDecs.stream().mapToInt(v -> v.names().size()).sum();
    }
}
