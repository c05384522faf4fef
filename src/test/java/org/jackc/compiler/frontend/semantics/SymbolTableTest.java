package org.jackc.compiler.frontend.semantics;

import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.diagnostics.Diagnostic;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.lexer.Keyword;
import org.jackc.compiler.frontend.lexer.SourceText;
import org.jackc.compiler.frontend.lexer.Token;
import org.jackc.compiler.frontend.lexer.TokenType;
import org.jackc.compiler.frontend.parser.ast.IdentifierNode;
import org.jackc.compiler.frontend.parser.ast.TypeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link ClassSymbolTable} and {@link SubroutineSymbolTable}.
 */
public class SymbolTableTest {

    private static final TypeNode INT = new TypeNode.Primitive(Keyword.INT);

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private static IdentifierNode id(String name) {
        return new IdentifierNode(new Token(TokenType.IDENTIFIER, new SourceText("T.jack", name),
                0, name.length(), name, 7, 1));
    }

    /**
     * Verifies that each kind numbers its entries densely from 0, independent of the other kinds.
     */
    @Test
    @Tag("unit")
    void testIndicesAreDensePerKind() {
        // Arrange
        ClassSymbolTable table = new ClassSymbolTable(diagnostics);

        // Act
        int f0 = table.insertField(id("x"), INT);
        int s0 = table.insertStatic(id("count"), INT);
        int f1 = table.insertField(id("y"), INT);

        // Assert
        assertThat(f0).isZero();
        assertThat(s0).isZero();
        assertThat(f1).isEqualTo(1);
        assertThat(table.fieldCount()).isEqualTo(2);
        assertThat(table.getField("y")).contains(new SymbolEntry("y", INT, SymbolKind.FIELD, 1));
        assertThat(table.getStatic("count")).map(SymbolEntry::kind).contains(SymbolKind.STATIC);
        assertThat(table.getField("count")).isEmpty();
        assertThat(table.count(SymbolKind.STATIC)).isEqualTo(1);
    }

    /**
     * Verifies that a re-declared name shadows the earlier entry, keeps consuming
     * indices and is reported as a warning.
     */
    @Test
    @Tag("unit")
    void testRedeclarationLastInsertWins() {
        // Arrange
        ClassSymbolTable table = new ClassSymbolTable(diagnostics);

        // Act
        table.insertField(id("x"), INT);
        table.insertField(id("x"), new TypeNode.ClassType(id("Array")));

        // Assert
        assertThat(table.getField("x")).map(SymbolEntry::index).contains(1);
        assertThat(table.fieldCount()).isEqualTo(2);
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::code, Diagnostic::lineNumber)
                .containsExactly(CompilerErrorCode.DUPLICATE_DECLARATION, 7);
    }

    /**
     * Verifies that a reserved receiver slot shifts declared arguments to start at 1.
     */
    @Test
    @Tag("unit")
    void testReceiverShiftsArguments() {
        // Arrange
        SubroutineSymbolTable table = new SubroutineSymbolTable(diagnostics);

        // Act
        int receiver = table.reserveReceiver();
        int a = table.insertArgument(id("a"), INT);
        int local = table.insertVar(id("i"), INT);

        // Assert
        assertThat(receiver).isZero();
        assertThat(a).isEqualTo(1);
        assertThat(local).isZero();
        assertThat(table.getArgument("this")).isEmpty();
        assertThat(table.getVar("i")).map(SymbolEntry::kind).contains(SymbolKind.VAR);
        assertThat(table.count(SymbolKind.ARGUMENT)).isEqualTo(2);
    }

    /**
     * Verifies that each table refuses kinds it does not hold.
     */
    @Test
    @Tag("unit")
    void testForeignKindsAreRejected() {
        ClassSymbolTable classTable = new ClassSymbolTable(diagnostics);
        SubroutineSymbolTable subroutineTable = new SubroutineSymbolTable(diagnostics);

        assertThatThrownBy(() -> classTable.get(SymbolKind.VAR, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> subroutineTable.count(SymbolKind.FIELD)).isInstanceOf(IllegalArgumentException.class);
        assertThat(subroutineTable.get(SymbolKind.ARGUMENT, "x")).isEmpty();
    }
}
