package org.jackc.compiler.api;

import org.jackc.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The diagnostics that led to the failure are kept so callers can inspect error codes.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception carrying the collected diagnostics.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The diagnostics reported up to the failure.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics collected before the compilation was aborted.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Returns the code of the first error diagnostic, if any.
     * @return The first error code, or {@link CompilerErrorCode#UNKNOWN_ERROR}.
     */
    public CompilerErrorCode getErrorCode() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::code)
                .findFirst()
                .orElse(CompilerErrorCode.UNKNOWN_ERROR);
    }
}
