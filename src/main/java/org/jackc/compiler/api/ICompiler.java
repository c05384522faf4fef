package org.jackc.compiler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface for the Jack compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code. One compilation unit holds exactly one class.
     *
     * @param sourceLines A list of strings representing the lines of the source code.
     * @param programName A name for the source, used in diagnostics.
     * @return The compiled {@link VmProgram}.
     * @throws CompilationException if errors occur during the compilation process.
     */
    VmProgram compile(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level: 3 enables debug and 4 also trace messages of the compiler phases.
     */
    void setVerbosity(int level);

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file.
     * @return The compiled {@link VmProgram}.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default VmProgram compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readAllLines(programPath), programPath.toString());
    }
}
