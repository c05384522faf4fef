package org.jackc.compiler.batch;

import org.jackc.compiler.api.CompilerErrorCode;

import java.nio.file.Path;

/**
 * The outcome of compiling one source file.
 *
 * @param source The source file.
 * @param output The written VM file, or {@code null} if compilation failed.
 * @param errorCode The code of the first error, or {@code null} on success.
 * @param errorMessage The error description, or {@code null} on success.
 */
public record FileResult(Path source, Path output, CompilerErrorCode errorCode, String errorMessage) {

    static FileResult success(Path source, Path output) {
        return new FileResult(source, output, null, null);
    }

    static FileResult failure(Path source, CompilerErrorCode errorCode, String errorMessage) {
        return new FileResult(source, null, errorCode, errorMessage);
    }

    /**
     * @return {@code true} if the file compiled and its VM file was written.
     */
    public boolean succeeded() {
        return errorCode == null;
    }
}
