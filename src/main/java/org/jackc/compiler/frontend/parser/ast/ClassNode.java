package org.jackc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the tree: one class per compilation unit.
 *
 * @param name The class name.
 * @param classVarDecs The {@code static} and {@code field} declarations, in source order.
 * @param subroutineDecs The constructors, functions and methods, in source order.
 */
public record ClassNode(
        IdentifierNode name,
        List<ClassVarDecNode> classVarDecs,
        List<SubroutineDecNode> subroutineDecs
) implements AstNode {

    public ClassNode {
        classVarDecs = List.copyOf(classVarDecs);
        subroutineDecs = List.copyOf(subroutineDecs);
    }
}
