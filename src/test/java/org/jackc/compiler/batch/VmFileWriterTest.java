package org.jackc.compiler.batch;

import org.jackc.compiler.api.VmProgram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link VmFileWriter}.
 */
@Tag("unit")
class VmFileWriterTest {

    @TempDir
    Path dir;

    private static final VmProgram PROGRAM = new VmProgram("Main", "Main.jack",
            List.of("function Main.main 0", "push constant 0", "return"));

    /**
     * Verifies that the output replaces the source extension and lands next to the source.
     */
    @Test
    void testWritesNextToSource() throws IOException {
        // Act
        Path written = new VmFileWriter(null, "vm", false).write(dir.resolve("Main.jack"), PROGRAM);

        // Assert
        assertThat(written).isEqualTo(dir.resolve("Main.vm"));
        assertThat(Files.readString(written)).isEqualTo("function Main.main 0\npush constant 0\nreturn");
    }

    /**
     * Verifies the output directory, a custom extension and indentation.
     */
    @Test
    void testOutputDirectoryExtensionAndIndent() throws IOException {
        // Arrange
        Path out = dir.resolve("build/vm");

        // Act
        Path written = new VmFileWriter(out, "txt", true).write(dir.resolve("src/Main.jack"), PROGRAM);

        // Assert
        assertThat(written).isEqualTo(out.resolve("Main.txt"));
        assertThat(Files.readString(written)).isEqualTo("function Main.main 0\n    push constant 0\n    return");
    }

    /**
     * Verifies that only the last extension is replaced.
     */
    @Test
    void testStemKeepsInnerDots() {
        VmFileWriter writer = new VmFileWriter(dir, "vm", false);

        assertThat(writer.targetFor(Path.of("a.b.jack"))).isEqualTo(dir.resolve("a.b.vm"));
        assertThat(writer.targetFor(Path.of("Makefile"))).isEqualTo(dir.resolve("Makefile.vm"));
    }
}
