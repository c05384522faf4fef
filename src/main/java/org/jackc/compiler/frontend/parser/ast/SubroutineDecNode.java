package org.jackc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A constructor, function or method declaration.
 *
 * @param kind The subroutine kind.
 * @param returnType The declared return type, empty for {@code void}.
 * @param name The subroutine name.
 * @param parameters The declared parameters, in order.
 * @param body The local variable declarations and statements.
 */
public record SubroutineDecNode(
        Kind kind,
        Optional<TypeNode> returnType,
        IdentifierNode name,
        List<ParameterNode> parameters,
        SubroutineBodyNode body
) implements AstNode {

    public SubroutineDecNode {
        parameters = List.copyOf(parameters);
    }

    /**
     * The calling convention a subroutine is compiled with.
     */
    public enum Kind {
        CONSTRUCTOR,
        FUNCTION,
        METHOD
    }
}
