package org.jackc.compiler.frontend.semantics;

import org.jackc.compiler.frontend.parser.ast.TypeNode;

/**
 * Represents a single variable binding in a symbol table.
 *
 * @param name The declared name.
 * @param type The declared type.
 * @param kind The namespace the name was declared in.
 * @param index The ordinal index within its kind, used directly as the VM segment offset.
 */
public record SymbolEntry(String name, TypeNode type, SymbolKind kind, int index) {
}
