package org.jackc.compiler.backend.vm;

import java.util.Locale;

/**
 * Operand-less arithmetic and logic commands of the stack machine.
 */
public enum ArithmeticCommand {
    ADD, SUB, NEG, EQ, GT, LT, AND, OR, NOT;

    /**
     * @return The command as written in VM code.
     */
    public String vmName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
