package org.jackc.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * The lexeme is an offset range into the shared {@link SourceText}; it is only
 * turned into a string when {@link #text()} is called.
 *
 * @param type The type of the token.
 * @param source The buffer the token was scanned from.
 * @param start Inclusive start offset of the lexeme.
 * @param end Exclusive end offset of the lexeme.
 * @param value The processed value: a {@link Keyword}, {@link Symbol}, {@link Integer} or string constant;
 *              {@code null} for identifiers, whose name is read through {@link #text()}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        SourceText source,
        int start,
        int end,
        Object value,
        int line,
        int column
) {

    /**
     * @return The exact text of the token from the source code.
     */
    public String text() {
        return type == TokenType.END_OF_FILE ? "<eof>" : source.slice(start, end);
    }

    /**
     * @return The logical file name from which this token originates.
     */
    public String fileName() {
        return source.fileName();
    }

    /**
     * @param keyword The keyword to test for.
     * @return true if this token is the given keyword.
     */
    public boolean is(Keyword keyword) {
        return type == TokenType.KEYWORD && value == keyword;
    }

    /**
     * @param symbol The symbol to test for.
     * @return true if this token is the given symbol.
     */
    public boolean is(Symbol symbol) {
        return type == TokenType.SYMBOL && value == symbol;
    }

    /**
     * @return A short description for error messages, e.g. {@code SYMBOL '+' (line 3)}.
     */
    public String describe() {
        return type + " '" + text() + "' (line " + line + ")";
    }
}
