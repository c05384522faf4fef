package org.jackc.compiler.frontend.parser.ast;

import org.jackc.compiler.frontend.lexer.Symbol;

import java.util.Arrays;
import java.util.Optional;

/**
 * The binary operators. There is no precedence between them.
 */
public enum BinaryOp {
    PLUS(Symbol.PLUS),
    MINUS(Symbol.MINUS),
    MULTIPLY(Symbol.ASTERISK),
    DIVIDE(Symbol.SLASH),
    AND(Symbol.AMPERSAND),
    OR(Symbol.PIPE),
    LESS_THAN(Symbol.LESS_THAN),
    GREATER_THAN(Symbol.GREATER_THAN),
    EQUAL(Symbol.EQUAL);

    private final Symbol symbol;

    BinaryOp(Symbol symbol) {
        this.symbol = symbol;
    }

    /**
     * @param symbol A symbol token value.
     * @return The operator spelled by the symbol, if any.
     */
    public static Optional<BinaryOp> fromSymbol(Symbol symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol == symbol).findFirst();
    }
}
