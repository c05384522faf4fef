package org.jackc.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The reserved words of the language.
 */
public enum Keyword {
    CLASS("class"),
    CONSTRUCTOR("constructor"),
    FUNCTION("function"),
    METHOD("method"),
    FIELD("field"),
    STATIC("static"),
    VAR("var"),
    INT("int"),
    CHAR("char"),
    BOOLEAN("boolean"),
    VOID("void"),
    TRUE("true"),
    FALSE("false"),
    NULL("null"),
    THIS("this"),
    LET("let"),
    DO("do"),
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    RETURN("return");

    private static final Map<String, Keyword> BY_LEXEME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Keyword::lexeme, Function.identity()));

    private final String lexeme;

    Keyword(String lexeme) {
        this.lexeme = lexeme;
    }

    /**
     * @return The source spelling of the keyword.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * Looks up a keyword by its exact, case-sensitive spelling.
     * @param text The candidate word.
     * @return The keyword, or empty if the word is an identifier.
     */
    public static Optional<Keyword> fromLexeme(String text) {
        return Optional.ofNullable(BY_LEXEME.get(text));
    }
}
