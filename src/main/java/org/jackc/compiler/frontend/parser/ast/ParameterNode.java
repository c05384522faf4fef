package org.jackc.compiler.frontend.parser.ast;

/**
 * A single formal parameter.
 *
 * @param type The declared type.
 * @param name The parameter name.
 */
public record ParameterNode(TypeNode type, IdentifierNode name) implements AstNode {
}
