package org.jackc.compiler.frontend.semantics;

import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.parser.ast.IdentifierNode;
import org.jackc.compiler.frontend.parser.ast.TypeNode;

import java.util.Optional;

/**
 * The subroutine-scope table: arguments and locals. A fresh table is created for every
 * subroutine and discarded when its code has been generated.
 */
public class SubroutineSymbolTable implements SymbolTable {

    private final KindTable arguments = new KindTable(SymbolKind.ARGUMENT);
    private final KindTable vars = new KindTable(SymbolKind.VAR);
    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics Receives a warning when a name is declared twice.
     */
    public SubroutineSymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Reserves the next argument slot for the implicit receiver of a method.
     * The slot has no name, so user parameters simply start one index later.
     * @return The reserved index, 0 when called before any parameter is declared.
     */
    public int reserveReceiver() {
        return arguments.reserve();
    }

    /**
     * Declares a formal parameter.
     * @param name The parameter name.
     * @param type The declared type.
     * @return The assigned index in the {@code argument} segment.
     */
    public int insertArgument(IdentifierNode name, TypeNode type) {
        return arguments.insert(name, type, diagnostics);
    }

    /**
     * Declares a local variable.
     * @param name The variable name.
     * @param type The declared type.
     * @return The assigned index in the {@code local} segment.
     */
    public int insertVar(IdentifierNode name, TypeNode type) {
        return vars.insert(name, type, diagnostics);
    }

    public Optional<SymbolEntry> getArgument(String name) {
        return arguments.get(name);
    }

    public Optional<SymbolEntry> getVar(String name) {
        return vars.get(name);
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
            case ARGUMENT -> arguments;
            case VAR -> vars;
            default -> throw new IllegalArgumentException("A subroutine symbol table holds no " + kind + " entries");
        };
    }
}
