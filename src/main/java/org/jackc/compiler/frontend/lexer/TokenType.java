package org.jackc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A reserved word, such as {@code class} or {@code let}. Value is a {@link Keyword}. */
    KEYWORD,
    /** A single-character symbol, such as {@code (} or {@code +}. Value is a {@link Symbol}. */
    SYMBOL,
    /** A decimal integer constant. Value is an {@link Integer}. */
    INTEGER_CONSTANT,
    /** A double-quoted string constant. Value is the {@link String} without quotes. */
    STRING_CONSTANT,
    /** A class, subroutine or variable name. Value is the name. */
    IDENTIFIER,
    /** Represents the end of the source file. */
    END_OF_FILE
}
