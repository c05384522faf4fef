package org.jackc.cli;

import org.jackc.cli.commands.CompileCommand;
import org.jackc.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the {@code jackc} command line, run in-process through picocli.
 */
@Tag("integration")
class CommandLineInterfaceTest {

    private static final String MAIN = """
        class Main {
            function void main() {
                do Output.printInt(1 + 2);
                return;
            }
        }
        """;

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void commandName_isJackc() {
        assertThat(new CommandLine(new CommandLineInterface()).getCommandName()).isEqualTo("jackc");
    }

    @Test
    void compile_directory_writesVmFileNextToSource() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("Main.jack"), MAIN);

        // Act
        int exitCode = run("compile", dir.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(Files.readAllLines(dir.resolve("Main.vm"))).containsExactly(
                "function Main.main 0",
                "push constant 1",
                "push constant 2",
                "add",
                "call Output.printInt 1",
                "pop temp 0",
                "push constant 0",
                "return");
        assertThat(out.toString()).contains("Compiled 1/1 file(s).");
    }

    @Test
    void compile_withOutputAndIndent_writesIndentedFileIntoOutputDirectory() throws IOException {
        // Arrange
        Path source = dir.resolve("Main.jack");
        Files.writeString(source, MAIN);
        Path target = dir.resolve("build");

        // Act
        int exitCode = run("compile", "--indent", "-o", target.toString(), source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(Files.readAllLines(target.resolve("Main.vm")))
                .startsWith("function Main.main 0", "    push constant 1");
    }

    @Test
    void compile_invalidSource_returnsFailureAndKeepsGoodFiles() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("Bad.jack"), "class Bad { function void f() { let = 1; } }");
        Files.writeString(dir.resolve("Main.jack"), MAIN);

        // Act
        int exitCode = run("compile", dir.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_COMPILATION_FAILED);
        assertThat(dir.resolve("Bad.vm")).doesNotExist();
        assertThat(dir.resolve("Main.vm")).exists();
        assertThat(err.toString()).contains("FAILED").contains("Bad.jack");
        assertThat(out.toString()).contains("Compiled 1/2 file(s).");
    }

    @Test
    void compile_missingInput_returnsMissingInputCode() {
        int exitCode = run("compile", dir.resolve("nope").toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_MISSING_INPUT);
        assertThat(err.toString()).contains("Input not found");
    }

    @Test
    void compile_missingConfigFile_returnsMissingInputCode() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("Main.jack"), MAIN);

        // Act
        int exitCode = run("--config", dir.resolve("absent.conf").toString(), "compile", dir.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_MISSING_INPUT);
        assertThat(err.toString()).contains("absent.conf");
    }

    @Test
    void compile_configFile_setsOutputExtension() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("Main.jack"), MAIN);
        Path config = dir.resolve("custom.conf");
        Files.writeString(config, "jackc.output.extension = out");

        // Act
        int exitCode = run("-c", config.toString(), "compile", dir.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(dir.resolve("Main.out")).exists();
    }
}
