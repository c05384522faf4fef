package org.jackc.compiler.frontend.semantics;

/**
 * The four independent variable namespaces. Each kind numbers its entries from 0.
 */
public enum SymbolKind {
    /** Class-level, shared by all instances. */
    STATIC,
    /** Class-level, one slot per instance. */
    FIELD,
    /** Subroutine-level formal parameter. */
    ARGUMENT,
    /** Subroutine-level local variable. */
    VAR
}
