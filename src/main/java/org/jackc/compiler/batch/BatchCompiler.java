package org.jackc.compiler.batch;

import org.jackc.compiler.api.CompilationException;
import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.api.ICompiler;
import org.jackc.compiler.api.VmProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Compiles a single source file or every source file of a directory.
 * <p>
 * Each file gets its own compiler instance, so a failure is isolated to that file and
 * the remaining files are still compiled. With a parallelism above 1 files are compiled
 * on a fixed thread pool; results are always reported in input order.
 */
public class BatchCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(BatchCompiler.class);

    /** Extension of Jack source files. */
    public static final String SOURCE_EXTENSION = ".jack";

    private final Supplier<? extends ICompiler> compilerFactory;
    private final VmFileWriter fileWriter;
    private final int parallelism;

    /**
     * @param compilerFactory Creates a fresh compiler for every file.
     * @param fileWriter Writes the compiled programs.
     * @param parallelism The number of files compiled at the same time, at least 1.
     */
    public BatchCompiler(Supplier<? extends ICompiler> compilerFactory, VmFileWriter fileWriter, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.compilerFactory = compilerFactory;
        this.fileWriter = fileWriter;
        this.parallelism = parallelism;
    }

    /**
     * Lists the sources of an input path.
     * @param input A source file, or a directory whose {@code .jack} files are compiled (not recursively).
     * @return The file itself, or the directory's source files sorted by name.
     * @throws NoSuchFileException if the input does not exist.
     * @throws IOException if the directory cannot be listed.
     */
    public static List<Path> collectSources(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new NoSuchFileException(input.toString());
        }
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> entries = Files.list(input)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Compiles all sources of the input path.
     * @param input A source file or a directory.
     * @return One result per source file.
     * @throws IOException if the input cannot be listed.
     * @throws InterruptedException if interrupted while waiting for parallel compilations.
     */
    public BatchResult compile(Path input) throws IOException, InterruptedException {
        List<Path> sources = collectSources(input);
        LOG.info("Compiling {} source file(s) from {}", sources.size(), input);
        if (sources.isEmpty()) {
            LOG.warn("No {} files found in {}", SOURCE_EXTENSION, input);
        }

        List<FileResult> results = parallelism > 1 && sources.size() > 1
                ? compileParallel(sources)
                : compileSequential(sources);
        BatchResult batch = new BatchResult(results);
        LOG.info("Compiled {}/{} file(s)", batch.successCount(), results.size());
        return batch;
    }

    private List<FileResult> compileSequential(List<Path> sources) {
        List<FileResult> results = new ArrayList<>(sources.size());
        for (Path source : sources) {
            results.add(compileFile(source));
        }
        return results;
    }

    private List<FileResult> compileParallel(List<Path> sources) throws InterruptedException {
        ExecutorService executorService = Executors.newFixedThreadPool(Math.min(parallelism, sources.size()));
        try {
            List<Future<FileResult>> futures = new ArrayList<>(sources.size());
            for (Path source : sources) {
                futures.add(executorService.submit(() -> compileFile(source)));
            }
            List<FileResult> results = new ArrayList<>(sources.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    LOG.error("Compilation of {} failed unexpectedly", sources.get(i), e.getCause());
                    results.add(FileResult.failure(sources.get(i), CompilerErrorCode.UNKNOWN_ERROR,
                            String.valueOf(e.getCause())));
                }
            }
            return results;
        } finally {
            executorService.shutdownNow();
        }
    }

    /**
     * Compiles one file and writes its VM file. Never throws for a bad source.
     * @param source The source file.
     * @return The result for this file.
     */
    FileResult compileFile(Path source) {
        ICompiler compiler = compilerFactory.get();
        try {
            VmProgram program = compiler.compile(source);
            Path output = fileWriter.write(source, program);
            LOG.debug("{} -> {} ({} instruction(s))", source, output, program.instructions().size());
            return FileResult.success(source, output);
        } catch (CompilationException e) {
            LOG.error("Compilation of {} failed:\n{}", source, e.getMessage());
            return FileResult.failure(source, e.getErrorCode(), e.getMessage());
        } catch (IOException e) {
            LOG.error("I/O error for {}: {}", source, e.getMessage());
            return FileResult.failure(source, CompilerErrorCode.IO_ERROR_READING_FILE, e.toString());
        }
    }
}
