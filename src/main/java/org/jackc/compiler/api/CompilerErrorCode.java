package org.jackc.compiler.api;

/**
 * Defines unique, testable error codes for all diagnostics the compiler can report.
 * This decouples the test logic from the wording of the messages.
 */
public enum CompilerErrorCode {
    // region Lexical errors
    /** A character that cannot start any token. */
    UNEXPECTED_CHARACTER,
    /** A string constant without its closing quote on the same line. */
    UNTERMINATED_STRING,
    /** An integer constant outside 0..32767. */
    INTEGER_OUT_OF_RANGE,
    // endregion

    // region Parser errors
    /** The token stream did not match the expected production. */
    SYNTAX_ERROR,
    /** Tokens remained after the first class declaration (warning). */
    TRAILING_TOKENS,
    // endregion

    // region Code generation errors
    /** A variable could not be found in any of the four symbol namespaces. */
    UNRESOLVED_IDENTIFIER,
    /** An internal invariant of a construct was violated, e.g. a method call on an int. */
    MALFORMED_CONSTRUCT,
    /** A name was declared twice in the same namespace (warning). */
    DUPLICATE_DECLARATION,
    /** A local or argument is hidden by a field of the same name (warning). */
    SHADOWED_BY_FIELD,
    // endregion

    // region General errors
    /** An I/O error occurred while reading or writing a file. */
    IO_ERROR_READING_FILE,
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
