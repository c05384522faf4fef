package org.jackc.compiler.frontend.semantics;

import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.parser.ast.IdentifierNode;
import org.jackc.compiler.frontend.parser.ast.TypeNode;

import java.util.Optional;

/**
 * The class-scope table: statics and fields. It lives as long as the compiler of its class.
 */
public class ClassSymbolTable implements SymbolTable {

    private final KindTable statics = new KindTable(SymbolKind.STATIC);
    private final KindTable fields = new KindTable(SymbolKind.FIELD);
    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics Receives a warning when a name is declared twice.
     */
    public ClassSymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Declares a static variable.
     * @param name The variable name.
     * @param type The declared type.
     * @return The assigned index in the {@code static} segment.
     */
    public int insertStatic(IdentifierNode name, TypeNode type) {
        return statics.insert(name, type, diagnostics);
    }

    /**
     * Declares a field.
     * @param name The field name.
     * @param type The declared type.
     * @return The assigned index in the {@code this} segment.
     */
    public int insertField(IdentifierNode name, TypeNode type) {
        return fields.insert(name, type, diagnostics);
    }

    public Optional<SymbolEntry> getStatic(String name) {
        return statics.get(name);
    }

    public Optional<SymbolEntry> getField(String name) {
        return fields.get(name);
    }

    /**
     * @return The number of words an instance of the class occupies.
     */
    public int fieldCount() {
        return fields.count();
    }

    @Override
    public Optional<SymbolEntry> get(SymbolKind kind, String name) {
        return table(kind).get(name);
    }

    @Override
    public int count(SymbolKind kind) {
        return table(kind).count();
    }

    private KindTable table(SymbolKind kind) {
        return switch (kind) {
            case STATIC -> statics;
            case FIELD -> fields;
            default -> throw new IllegalArgumentException("A class symbol table holds no " + kind + " entries");
        };
    }
}
