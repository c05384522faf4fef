package org.jackc.compiler.frontend.semantics;

import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.parser.ast.IdentifierNode;
import org.jackc.compiler.frontend.parser.ast.TypeNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One namespace of a symbol table. The index of a new entry is the number of earlier
 * insertions, so indices are dense and never reused. Re-declaring a name replaces the
 * lookup entry but keeps the index that was already handed out.
 */
final class KindTable {

    private final SymbolKind kind;
    private final Map<String, SymbolEntry> entries = new HashMap<>();
    private int nextIndex = 0;

    KindTable(SymbolKind kind) {
        this.kind = kind;
    }

    int insert(IdentifierNode name, TypeNode type, DiagnosticsEngine diagnostics) {
        SymbolEntry entry = new SymbolEntry(name.name(), type, kind, nextIndex++);
        SymbolEntry previous = entries.put(entry.name(), entry);
        if (previous != null) {
            diagnostics.reportWarning(CompilerErrorCode.DUPLICATE_DECLARATION,
                    kind.name().toLowerCase() + " '" + entry.name() + "' is declared again; index "
                            + entry.index() + " now shadows index " + previous.index() + ".",
                    name.token().fileName(), name.line());
        }
        return entry.index();
    }

    int reserve() {
        return nextIndex++;
    }

    Optional<SymbolEntry> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    int count() {
        return nextIndex;
    }
}
