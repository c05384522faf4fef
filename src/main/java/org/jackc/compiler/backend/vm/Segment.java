package org.jackc.compiler.backend.vm;

import org.jackc.compiler.frontend.semantics.SymbolKind;

/**
 * The eight memory segments addressed by {@code push} and {@code pop}.
 */
public enum Segment {
    ARGUMENT("argument"),
    LOCAL("local"),
    STATIC("static"),
    CONSTANT("constant"),
    THIS("this"),
    THAT("that"),
    POINTER("pointer"),
    TEMP("temp");

    private final String vmName;

    Segment(String vmName) {
        this.vmName = vmName;
    }

    /**
     * @return The segment name as written in VM code.
     */
    public String vmName() {
        return vmName;
    }

    /**
     * Maps a variable kind to the segment its values live in.
     * @param kind The symbol kind.
     * @return {@code static}, {@code this}, {@code argument} or {@code local}.
     */
    public static Segment of(SymbolKind kind) {
        return switch (kind) {
            case STATIC -> STATIC;
            case FIELD -> THIS;
            case ARGUMENT -> ARGUMENT;
            case VAR -> LOCAL;
        };
    }
}
