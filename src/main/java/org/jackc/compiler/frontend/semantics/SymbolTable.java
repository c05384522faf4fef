package org.jackc.compiler.frontend.semantics;

import java.util.Optional;

/**
 * Read access shared by the class-scope and subroutine-scope tables.
 * Insertion is only available on the concrete types, so a subroutine table can
 * never receive a field and a class table never receives a local.
 */
public interface SymbolTable {

    /**
     * Looks a name up in one namespace.
     * @param kind The namespace to search.
     * @param name The variable name.
     * @return The entry, or empty if the name is not declared in that namespace.
     * @throws IllegalArgumentException if this table does not hold the given kind.
     */
    Optional<SymbolEntry> get(SymbolKind kind, String name);

    /**
     * Returns how many indices a namespace has handed out.
     * @param kind The namespace.
     * @return The number of insertions into that namespace.
     * @throws IllegalArgumentException if this table does not hold the given kind.
     */
    int count(SymbolKind kind);
}
