package org.jackc.compiler.backend.codegen;

import org.jackc.compiler.api.CompilationException;
import org.jackc.compiler.backend.vm.VmWriter;
import org.jackc.compiler.diagnostics.CompilerLogger;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.parser.ast.ClassNode;
import org.jackc.compiler.frontend.parser.ast.ClassVarDecNode;
import org.jackc.compiler.frontend.parser.ast.IdentifierNode;
import org.jackc.compiler.frontend.parser.ast.SubroutineDecNode;
import org.jackc.compiler.frontend.semantics.ClassSymbolTable;

import java.util.List;

/**
 * Generates the VM code of one class.
 * <p>
 * Class-level variable declarations are entered into the class symbol table first;
 * every subroutine is then compiled in declaration order by its own
 * {@link SubroutineCompiler}, which reads the class table and draws labels from
 * the class-wide counter.
 */
public class ClassCompiler {

    private final ClassNode classNode;
    private final DiagnosticsEngine diagnostics;
    private final ClassSymbolTable symbolTable;
    private final CompilerLogger log;
    private final VmWriter writer = new VmWriter();
    private int labelIndex = 0;

    /**
     * @param classNode The parsed class.
     * @param diagnostics The engine errors and warnings are reported to.
     * @param log The logger of the compilation unit.
     */
    public ClassCompiler(ClassNode classNode, DiagnosticsEngine diagnostics, CompilerLogger log) {
        this.classNode = classNode;
        this.diagnostics = diagnostics;
        this.log = log.forPhase(ClassCompiler.class);
        this.symbolTable = new ClassSymbolTable(diagnostics);
    }

    /**
     * Compiles the whole class.
     * @return The instruction lines of all subroutines, in declaration order.
     * @throws CompilationException on the first unresolved identifier or malformed construct;
     *         no further instructions are generated for the class.
     */
    public List<String> compile() throws CompilationException {
        for (ClassVarDecNode classVarDec : classNode.classVarDecs()) {
            declare(classVarDec);
        }
        log.debug("class {}: {} field(s)", className(), symbolTable.fieldCount());

        for (SubroutineDecNode subroutineDec : classNode.subroutineDecs()) {
            new SubroutineCompiler(this, subroutineDec).compile();
        }
        return writer.lines();
    }

    private void declare(ClassVarDecNode classVarDec) {
        for (IdentifierNode name : classVarDec.names()) {
            switch (classVarDec.kind()) {
                case STATIC -> symbolTable.insertStatic(name, classVarDec.type());
                case FIELD -> symbolTable.insertField(name, classVarDec.type());
            }
        }
    }

    /**
     * Hands out the next label of this class, {@code ClassName_n}.
     * Labels are unique across all subroutines of the class.
     * @return A fresh label name.
     */
    String nextLabel() {
        return className() + "_" + labelIndex++;
    }

    String className() {
        return classNode.name().name();
    }

    ClassSymbolTable symbolTable() {
        return symbolTable;
    }

    DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    VmWriter writer() {
        return writer;
    }

    CompilerLogger log() {
        return log;
    }
}
