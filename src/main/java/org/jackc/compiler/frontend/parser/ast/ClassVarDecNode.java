package org.jackc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code static} or {@code field} declaration of one or more names.
 *
 * @param kind Whether the names are statics or fields.
 * @param type The declared type.
 * @param names The declared names, in source order.
 */
public record ClassVarDecNode(Kind kind, TypeNode type, List<IdentifierNode> names) implements AstNode {

    public ClassVarDecNode {
        names = List.copyOf(names);
    }

    /**
     * The storage class of a class-level variable.
     */
    public enum Kind {
        STATIC,
        FIELD
    }
}
