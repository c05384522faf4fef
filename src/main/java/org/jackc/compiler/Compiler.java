package org.jackc.compiler;

import org.jackc.compiler.api.CompilationException;
import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.api.ICompiler;
import org.jackc.compiler.api.VmProgram;
import org.jackc.compiler.backend.codegen.ClassCompiler;
import org.jackc.compiler.diagnostics.CompilerLogger;
import org.jackc.compiler.diagnostics.Diagnostic;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.lexer.Lexer;
import org.jackc.compiler.frontend.lexer.SourceText;
import org.jackc.compiler.frontend.lexer.Token;
import org.jackc.compiler.frontend.parser.Parser;
import org.jackc.compiler.frontend.parser.ParserOptions;
import org.jackc.compiler.frontend.parser.ast.ClassNode;

import java.util.List;
import java.util.Optional;

/**
 * The main compiler implementation. This class runs the pipeline from source text
 * to VM instructions for one compilation unit: lexing, parsing and code generation.
 * It is not thread-safe; use one instance per thread.
 */
public class Compiler implements ICompiler {

    private final ParserOptions parserOptions;
    private List<Diagnostic> lastDiagnostics = List.of();
    private int verbosity = -1;

    /**
     * Creates a compiler with the default parser options.
     */
    public Compiler() {
        this(ParserOptions.DEFAULTS);
    }

    /**
     * @param parserOptions The grammar options, such as operator chaining.
     */
    public Compiler(ParserOptions parserOptions) {
        this.parserOptions = parserOptions;
    }

    @Override
    public VmProgram compile(List<String> sourceLines, String programName) throws CompilationException {
        CompilerLogger log = CompilerLogger.forUnit(programName, verbosity >= 0 ? verbosity : CompilerLogger.INFO);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            return run(sourceLines, programName, diagnostics, log);
        } finally {
            lastDiagnostics = diagnostics.getDiagnostics();
        }
    }

    private VmProgram run(List<String> sourceLines, String programName, DiagnosticsEngine diagnostics,
                          CompilerLogger log) throws CompilationException {
        // Phase 1: Lexical Analysis
        SourceText source = new SourceText(programName, String.join("\n", sourceLines));
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        log.forPhase(Lexer.class).trace("{} token(s)", tokens.size());

        // Phase 2: Parsing
        Optional<ClassNode> classNode = new Parser(tokens, diagnostics, parserOptions).parse();
        if (classNode.isEmpty()) {
            if (!diagnostics.hasErrors()) {
                diagnostics.reportError(CompilerErrorCode.SYNTAX_ERROR, "No class declaration found.", programName, 1);
            }
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        // Phase 3: Code Generation
        String className = classNode.get().name().name();
        List<String> instructions = new ClassCompiler(classNode.get(), diagnostics, log).compile();
        log.debug("compiled class {} to {} instruction(s)", className, instructions.size());

        return new VmProgram(className, programName, instructions);
    }

    /**
     * Returns the diagnostics of the most recent {@link #compile} call, warnings included.
     * @return The diagnostics, empty before the first compilation.
     */
    public List<Diagnostic> getLastDiagnostics() {
        return lastDiagnostics;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
