package org.jackc.compiler.batch;

import java.util.List;

/**
 * The outcome of a batch run, one entry per source file in input order.
 *
 * @param files The per-file results.
 */
public record BatchResult(List<FileResult> files) {

    public BatchResult {
        files = List.copyOf(files);
    }

    /**
     * @return {@code true} if every file compiled.
     */
    public boolean succeeded() {
        return files.stream().allMatch(FileResult::succeeded);
    }

    /**
     * @return The results of the files that failed, in input order.
     */
    public List<FileResult> failures() {
        return files.stream().filter(f -> !f.succeeded()).toList();
    }

    public int successCount() {
        return files.size() - failures().size();
    }
}
