package org.jackc.compiler.frontend.parser;

/**
 * Grammar switches for the {@link Parser}.
 *
 * @param chainedOperators If false, an expression holds a head term and at most one
 *                         {@code (op term)} pair; any further operator is left for the
 *                         enclosing construct. If true, any number of pairs is parsed.
 */
public record ParserOptions(boolean chainedOperators) {

    /** One operator pair per expression level. */
    public static final ParserOptions DEFAULTS = new ParserOptions(false);
}
