package org.jackc.cli.commands;

import com.typesafe.config.ConfigException;
import org.jackc.cli.CommandLineInterface;
import org.jackc.compiler.Compiler;
import org.jackc.compiler.batch.BatchCompiler;
import org.jackc.compiler.batch.BatchResult;
import org.jackc.compiler.batch.FileResult;
import org.jackc.compiler.batch.VmFileWriter;
import org.jackc.compiler.diagnostics.CompilerLogger;
import org.jackc.compiler.frontend.parser.ParserOptions;
import org.jackc.config.CompilerOptions;
import org.jackc.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Compiles a .jack file, or every .jack file of a directory, to .vm files.")
public class CompileCommand implements Callable<Integer> {

    /** Exit code when every file compiled. */
    public static final int EXIT_OK = 0;
    /** Exit code when at least one file failed. */
    public static final int EXIT_COMPILATION_FAILED = 1;
    /** Exit code when the input or the configuration file does not exist. */
    public static final int EXIT_MISSING_INPUT = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "<input>", description = "A .jack file or a directory of .jack files.")
    private Path input;

    @Option(names = {"-o", "--output"}, paramLabel = "<dir>",
            description = "Directory for the .vm files (default: next to each source).")
    private Path outputDirectory;

    @Option(names = "--indent", description = "Indent all lines except function and label lines.")
    private Boolean indent;

    @Option(names = "--chained-operators",
            description = "Accept any number of binary operators per expression, evaluated left to right.")
    private Boolean chainedOperators;

    @Option(names = {"-j", "--threads"}, paramLabel = "<threads>", description = "Number of files compiled in parallel.")
    private Integer threads;

    @Option(names = {"-v", "--verbosity"}, paramLabel = "<level>",
            description = "Compiler verbosity: 3=debug, 4=trace; lower values log no compiler internals.")
    private Integer verbosity;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        if (!Files.exists(input)) {
            err.println("Input not found: " + input.toAbsolutePath());
            return EXIT_MISSING_INPUT;
        }

        CompilerOptions options;
        try {
            options = CompilerOptions.fromConfig(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println(e.getMessage());
            return EXIT_MISSING_INPUT;
        }
        if (indent != null) options = options.withIndent(indent);
        if (chainedOperators != null) options = options.withChainedOperators(chainedOperators);
        if (threads != null) options = options.withParallelism(threads);
        if (verbosity != null && verbosity >= CompilerLogger.DEBUG) {
            LoggingConfigurator.setLevel("org.jackc", verbosity >= CompilerLogger.TRACE ? "TRACE" : "DEBUG");
        }

        final ParserOptions parserOptions = options.parserOptions();
        final VmFileWriter writer = new VmFileWriter(outputDirectory, options.outputExtension(), options.indent());
        final BatchCompiler batchCompiler = new BatchCompiler(() -> {
            Compiler compiler = new Compiler(parserOptions);
            if (verbosity != null) {
                compiler.setVerbosity(verbosity);
            }
            return compiler;
        }, writer, options.parallelism());

        final BatchResult result = batchCompiler.compile(input);
        for (FileResult file : result.files()) {
            if (file.succeeded()) {
                out.println(file.source() + " -> " + file.output());
            } else {
                err.println("FAILED " + file.source() + " [" + file.errorCode() + "]");
                err.println(file.errorMessage());
            }
        }
        out.println("Compiled " + result.successCount() + "/" + result.files().size() + " file(s).");
        out.flush();
        err.flush();
        return result.succeeded() ? EXIT_OK : EXIT_COMPILATION_FAILED;
    }
}
