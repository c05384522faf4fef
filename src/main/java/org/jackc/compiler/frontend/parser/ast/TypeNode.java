package org.jackc.compiler.frontend.parser.ast;

import org.jackc.compiler.frontend.lexer.Keyword;

import java.util.Optional;

/**
 * The declared type of a variable, parameter or return value.
 * Every value is a machine word at run time; the type only matters for
 * resolving the target class of a method call on an object variable.
 */
public sealed interface TypeNode extends AstNode permits TypeNode.Primitive, TypeNode.ClassType {

    /**
     * Returns the class name if this is an object type.
     * @return The class name, or empty for {@code int}, {@code char} and {@code boolean}.
     */
    Optional<String> className();

    /**
     * One of {@code int}, {@code char} or {@code boolean}.
     * @param keyword The type keyword.
     */
    record Primitive(Keyword keyword) implements TypeNode {
        @Override
        public Optional<String> className() {
            return Optional.empty();
        }
    }

    /**
     * A class type such as {@code Array} or {@code Point}.
     * @param name The class name.
     */
    record ClassType(IdentifierNode name) implements TypeNode {
        @Override
        public Optional<String> className() {
            return Optional.of(name.name());
        }
    }
}
