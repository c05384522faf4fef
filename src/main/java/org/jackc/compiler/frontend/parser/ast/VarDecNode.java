package org.jackc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code var} declaration of one or more locals.
 *
 * @param type The declared type.
 * @param names The declared names, in source order.
 */
public record VarDecNode(TypeNode type, List<IdentifierNode> names) implements AstNode {

    public VarDecNode {
        names = List.copyOf(names);
    }
}
