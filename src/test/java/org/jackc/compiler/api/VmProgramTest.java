package org.jackc.compiler.api;

import org.jackc.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link VmProgram} rendering and {@link CompilationException} error codes.
 */
public class VmProgramTest {

    private static final VmProgram PROGRAM = new VmProgram("Main", "Main.jack", List.of(
            "function Main.main 0",
            "label Main_0",
            "push constant 0",
            "return"));

    /**
     * Verifies that lines are joined with newlines and the last line has none.
     */
    @Test
    @Tag("unit")
    void testRenderPlain() {
        assertThat(PROGRAM.render(false))
                .isEqualTo("function Main.main 0\nlabel Main_0\npush constant 0\nreturn");
    }

    /**
     * Verifies that indentation skips function and label lines.
     */
    @Test
    @Tag("unit")
    void testRenderIndented() {
        assertThat(PROGRAM.render(true))
                .isEqualTo("function Main.main 0\nlabel Main_0\n    push constant 0\n    return");
    }

    /**
     * Verifies that an empty program renders as an empty string.
     */
    @Test
    @Tag("unit")
    void testRenderEmpty() {
        assertThat(new VmProgram("E", "E.jack", List.of()).render(true)).isEmpty();
    }

    /**
     * Verifies that the error code of an exception is the first error, skipping warnings.
     */
    @Test
    @Tag("unit")
    void testExceptionErrorCode() {
        // Arrange
        List<Diagnostic> diagnostics = List.of(
                new Diagnostic(Diagnostic.Type.WARNING, CompilerErrorCode.SHADOWED_BY_FIELD, "w", "A.jack", 1),
                new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.UNRESOLVED_IDENTIFIER, "e", "A.jack", 2));

        // Act
        CompilationException exception = new CompilationException("failed", diagnostics);

        // Assert
        assertThat(exception.getErrorCode()).isEqualTo(CompilerErrorCode.UNRESOLVED_IDENTIFIER);
        assertThat(new CompilationException("plain", List.of()).getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_ERROR);
        assertThat(diagnostics.get(1)).hasToString("[ERROR] A.jack:2: e");
    }
}
