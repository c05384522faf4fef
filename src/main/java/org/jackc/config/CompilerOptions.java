package org.jackc.config;

import com.typesafe.config.Config;
import org.jackc.compiler.frontend.parser.ParserOptions;

/**
 * The settings of a compiler run, read from the {@code jackc} configuration block.
 *
 * @param chainedOperators Whether expressions take any number of operators, left to right.
 * @param outputExtension The extension of written VM files, without the dot.
 * @param indent Whether VM files indent all lines except function and label lines.
 * @param parallelism The number of files compiled at the same time.
 */
public record CompilerOptions(boolean chainedOperators, String outputExtension, boolean indent, int parallelism) {

    private static final String ROOT = "jackc";

    public CompilerOptions {
        if (outputExtension == null || outputExtension.isBlank()) {
            throw new IllegalArgumentException("output extension must not be blank");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
    }

    /**
     * Reads the options from a configuration that contains {@code reference.conf} defaults.
     * @param config The merged configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config jackc = config.getConfig(ROOT);
        return new CompilerOptions(
                jackc.getBoolean("parser.chained-operators"),
                jackc.getString("output.extension"),
                jackc.getBoolean("output.indent"),
                jackc.getInt("compile.parallelism"));
    }

    public ParserOptions parserOptions() {
        return new ParserOptions(chainedOperators);
    }

    public CompilerOptions withChainedOperators(boolean value) {
        return new CompilerOptions(value, outputExtension, indent, parallelism);
    }

    public CompilerOptions withIndent(boolean value) {
        return new CompilerOptions(chainedOperators, outputExtension, value, parallelism);
    }

    public CompilerOptions withParallelism(int value) {
        return new CompilerOptions(chainedOperators, outputExtension, indent, value);
    }
}
