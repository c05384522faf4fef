package org.jackc.compiler.frontend.parser.ast;

import org.jackc.compiler.frontend.lexer.Symbol;

import java.util.Optional;

/**
 * The prefix operators: arithmetic negation and bitwise not.
 */
public enum UnaryOp {
    NEGATE,
    NOT;

    /**
     * @param symbol A symbol token value.
     * @return The operator spelled by the symbol, if any.
     */
    public static Optional<UnaryOp> fromSymbol(Symbol symbol) {
        return switch (symbol) {
            case MINUS -> Optional.of(NEGATE);
            case TILDE -> Optional.of(NOT);
            default -> Optional.empty();
        };
    }
}
