package org.jackc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A subroutine call, usable as a term or as the body of a {@code do} statement.
 */
public sealed interface SubroutineCallNode extends TermNode permits SubroutineCallNode.Call, SubroutineCallNode.ClassCall {

    /**
     * @return The name of the called subroutine.
     */
    IdentifierNode subroutineName();

    /**
     * @return The argument expressions, in order.
     */
    List<ExpressionNode> arguments();

    /**
     * {@code name(args)}: a method call on the current object.
     * @param subroutineName The method name.
     * @param arguments The arguments.
     */
    record Call(IdentifierNode subroutineName, List<ExpressionNode> arguments) implements SubroutineCallNode {

        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * {@code target.name(args)}: a method call on a variable, or a function/constructor call on a class.
     * @param target The variable or class name left of the dot.
     * @param subroutineName The subroutine name.
     * @param arguments The arguments.
     */
    record ClassCall(IdentifierNode target, IdentifierNode subroutineName, List<ExpressionNode> arguments)
            implements SubroutineCallNode {

        public ClassCall {
            arguments = List.copyOf(arguments);
        }
    }
}
