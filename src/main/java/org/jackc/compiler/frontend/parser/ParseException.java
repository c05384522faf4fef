package org.jackc.compiler.frontend.parser;

import org.jackc.compiler.frontend.lexer.Token;

/**
 * Thrown inside the {@link Parser} when a production does not match. The parser
 * reports the matching diagnostic before throwing and catches it at class level,
 * so the partial tree is discarded.
 */
public class ParseException extends RuntimeException {

    private final String expected;
    private final transient Token actual;

    /**
     * @param expected A description of the expected pattern.
     * @param actual The token that was found instead.
     */
    public ParseException(String expected, Token actual) {
        super("Expected " + expected + " but got " + actual.describe());
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * @return A description of the expected pattern.
     */
    public String getExpected() {
        return expected;
    }

    /**
     * @return The token that was found instead.
     */
    public Token getActual() {
        return actual;
    }
}
