package org.jackc.compiler.frontend.lexer;

/**
 * The owned source buffer of one compilation unit. Tokens refer to it by offset,
 * so it outlives every token, AST node and symbol derived from it.
 *
 * @param fileName The logical file name, used in diagnostics.
 * @param content The full source text.
 */
public record SourceText(String fileName, String content) {

    /**
     * Returns the text between two offsets.
     * @param start Inclusive start offset.
     * @param end Exclusive end offset.
     * @return The substring of the buffer.
     */
    public String slice(int start, int end) {
        return content.substring(start, end);
    }

    /**
     * @return The number of characters in the buffer.
     */
    public int length() {
        return content.length();
    }
}
