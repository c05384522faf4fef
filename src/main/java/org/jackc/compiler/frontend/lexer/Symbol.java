package org.jackc.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The single-character symbols of the language.
 */
public enum Symbol {
    LEFT_CURLY_BRACE('{'),
    RIGHT_CURLY_BRACE('}'),
    LEFT_PARENTHESIS('('),
    RIGHT_PARENTHESIS(')'),
    LEFT_SQUARE_BRACKET('['),
    RIGHT_SQUARE_BRACKET(']'),
    DOT('.'),
    COMMA(','),
    SEMICOLON(';'),
    PLUS('+'),
    MINUS('-'),
    ASTERISK('*'),
    SLASH('/'),
    AMPERSAND('&'),
    PIPE('|'),
    LESS_THAN('<'),
    GREATER_THAN('>'),
    EQUAL('='),
    TILDE('~');

    private static final Map<Character, Symbol> BY_CHAR = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Symbol::character, Function.identity()));

    private final char character;

    Symbol(char character) {
        this.character = character;
    }

    /**
     * @return The source character of the symbol.
     */
    public char character() {
        return character;
    }

    /**
     * Looks up a symbol by its character.
     * @param c The candidate character.
     * @return The symbol, or empty if the character is not a symbol.
     */
    public static Optional<Symbol> fromChar(char c) {
        return Optional.ofNullable(BY_CHAR.get(c));
    }
}
