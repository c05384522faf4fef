package org.jackc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link ConfigLoader} precedence order and {@link CompilerOptions} mapping.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String PARALLELISM_PROPERTY = "jackc.compile.parallelism";

    @TempDir
    Path dir;

    private File missing;

    @BeforeEach
    void setUp() {
        missing = dir.resolve("absent.conf").toFile();
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(PARALLELISM_PROPERTY);
        ConfigFactory.invalidateCaches();
    }

    private File write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    void load_withoutFiles_shouldUseReferenceDefaults() {
        // When
        final CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.load(null, missing));

        // Then
        assertThat(options).isEqualTo(new CompilerOptions(false, "vm", false, 1));
    }

    @Test
    void load_withExplicitFile_shouldOverrideDefaults() throws IOException {
        // Given
        final File file = write("custom.conf", "jackc.output.indent = true\njackc.parser.chained-operators = true");

        // When
        final CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.load(file, missing));

        // Then
        assertThat(options.indent()).isTrue();
        assertThat(options.chainedOperators()).isTrue();
        assertThat(options.outputExtension()).isEqualTo("vm");
    }

    @Test
    void load_withExplicitFile_shouldIgnoreWorkingDirectoryFile() throws IOException {
        // Given
        final File explicit = write("custom.conf", "jackc.output.extension = out");
        final File local = write("jackc.conf", "jackc.output.extension = local\njackc.output.indent = true");

        // When
        final Config config = ConfigLoader.load(explicit, local);

        // Then
        assertThat(config.getString("jackc.output.extension")).isEqualTo("out");
        assertThat(config.getBoolean("jackc.output.indent")).isFalse();
    }

    @Test
    void load_withWorkingDirectoryFile_shouldUseIt() throws IOException {
        // Given
        final File local = write("jackc.conf", "jackc { compile { parallelism = 4 } }");

        // When
        final Config config = ConfigLoader.load(null, local);

        // Then
        assertThat(config.getInt(PARALLELISM_PROPERTY)).isEqualTo(4);
    }

    @Test
    void load_withSystemProperty_shouldBeatFile() throws IOException {
        // Given
        final File file = write("custom.conf", "jackc.compile.parallelism = 4");
        System.setProperty(PARALLELISM_PROPERTY, "3");
        ConfigFactory.invalidateCaches();

        // When
        final Config config = ConfigLoader.load(file, missing);

        // Then
        assertThat(config.getInt(PARALLELISM_PROPERTY)).isEqualTo(3);
    }

    @Test
    void load_withMissingExplicitFile_shouldFail() {
        assertThatThrownBy(() -> ConfigLoader.load(missing, missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.conf");
    }

    @Test
    void options_shouldRejectInvalidValues() {
        final Config config = ConfigFactory.parseString("jackc.compile.parallelism = 0")
                .withFallback(ConfigFactory.parseResources("reference.conf"));

        assertThatThrownBy(() -> CompilerOptions.fromConfig(config)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void options_withers_shouldReplaceOneValue() {
        final CompilerOptions options = new CompilerOptions(false, "vm", false, 1)
                .withIndent(true)
                .withParallelism(2)
                .withChainedOperators(true);

        assertThat(options).isEqualTo(new CompilerOptions(true, "vm", true, 2));
        assertThat(options.parserOptions().chainedOperators()).isTrue();
    }
}
