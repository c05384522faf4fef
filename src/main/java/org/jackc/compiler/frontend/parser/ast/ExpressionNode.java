package org.jackc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A head term followed by {@code (op term)} pairs, evaluated strictly left to right.
 * In the default parser mode the tail holds at most one pair.
 *
 * @param head The first term.
 * @param tail The operator/term pairs following the head.
 */
public record ExpressionNode(TermNode head, List<OpTerm> tail) implements AstNode {

    public ExpressionNode {
        tail = List.copyOf(tail);
    }

    /**
     * A binary operator and its right-hand term.
     * @param op The operator.
     * @param term The right operand.
     */
    public record OpTerm(BinaryOp op, TermNode term) {}
}
