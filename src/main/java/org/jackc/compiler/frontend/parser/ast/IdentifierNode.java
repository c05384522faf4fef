package org.jackc.compiler.frontend.parser.ast;

import org.jackc.compiler.frontend.lexer.Token;

/**
 * A class, subroutine or variable name.
 *
 * @param token The identifier token; its text is the name.
 */
public record IdentifierNode(Token token) implements AstNode {

    /**
     * @return The identifier as written in the source.
     */
    public String name() {
        return token.text();
    }

    /**
     * @return The line the identifier appears on.
     */
    public int line() {
        return token.line();
    }
}
