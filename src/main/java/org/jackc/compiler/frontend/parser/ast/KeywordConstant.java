package org.jackc.compiler.frontend.parser.ast;

import org.jackc.compiler.frontend.lexer.Keyword;

import java.util.Optional;

/**
 * The keyword constants {@code true}, {@code false}, {@code null} and {@code this}.
 */
public enum KeywordConstant {
    TRUE,
    FALSE,
    NULL,
    THIS;

    /**
     * @param keyword A keyword token value.
     * @return The constant spelled by the keyword, if any.
     */
    public static Optional<KeywordConstant> fromKeyword(Keyword keyword) {
        return switch (keyword) {
            case TRUE -> Optional.of(TRUE);
            case FALSE -> Optional.of(FALSE);
            case NULL -> Optional.of(NULL);
            case THIS -> Optional.of(THIS);
            default -> Optional.empty();
        };
    }
}
