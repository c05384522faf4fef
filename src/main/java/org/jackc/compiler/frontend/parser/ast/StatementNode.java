package org.jackc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A statement inside a subroutine body.
 */
public sealed interface StatementNode extends AstNode permits
        StatementNode.Let, StatementNode.If, StatementNode.While, StatementNode.Do, StatementNode.Return {

    /**
     * {@code let target[index]? = value;}
     * @param target The variable assigned to.
     * @param index The array index, present for array element assignment.
     * @param value The assigned expression.
     */
    record Let(IdentifierNode target, Optional<ExpressionNode> index, ExpressionNode value) implements StatementNode {}

    /**
     * {@code if (condition) { thenBranch } else { elseBranch }}
     * @param condition The condition.
     * @param thenBranch The statements run when the condition holds.
     * @param elseBranch The statements of the optional else block.
     */
    record If(ExpressionNode condition, List<StatementNode> thenBranch, Optional<List<StatementNode>> elseBranch)
            implements StatementNode {

        public If {
            thenBranch = List.copyOf(thenBranch);
            elseBranch = elseBranch.map(List::copyOf);
        }
    }

    /**
     * {@code while (condition) { body }}
     * @param condition The loop condition.
     * @param body The loop body.
     */
    record While(ExpressionNode condition, List<StatementNode> body) implements StatementNode {

        public While {
            body = List.copyOf(body);
        }
    }

    /**
     * {@code do call;} The return value of the call is discarded.
     * @param call The subroutine call.
     */
    record Do(SubroutineCallNode call) implements StatementNode {}

    /**
     * {@code return value?;} A missing value returns 0.
     * @param value The returned expression, if any.
     */
    record Return(Optional<ExpressionNode> value) implements StatementNode {}
}
