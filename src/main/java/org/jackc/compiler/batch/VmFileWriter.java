package org.jackc.compiler.batch;

import org.jackc.compiler.api.VmProgram;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a compiled program to {@code <stem>.<extension>}, either next to its source
 * or into a fixed output directory.
 */
public class VmFileWriter {

    private final Path outputDirectory;
    private final String extension;
    private final boolean indent;

    /**
     * @param outputDirectory The directory to write into, or {@code null} to write next to each source.
     * @param extension The output file extension without the dot.
     * @param indent Whether to indent all lines except function and label lines.
     */
    public VmFileWriter(Path outputDirectory, String extension, boolean indent) {
        this.outputDirectory = outputDirectory;
        this.extension = extension;
        this.indent = indent;
    }

    /**
     * Writes the program, replacing an existing file.
     * @param source The source file the program was compiled from.
     * @param program The compiled program.
     * @return The path of the written file.
     * @throws IOException if the file cannot be written.
     */
    public Path write(Path source, VmProgram program) throws IOException {
        Path target = targetFor(source);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, program.render(indent), StandardCharsets.UTF_8);
        return target;
    }

    /**
     * @param source A source file.
     * @return The path its VM file is written to.
     */
    public Path targetFor(Path source) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path directory = outputDirectory != null ? outputDirectory : source.toAbsolutePath().getParent();
        return directory.resolve(stem + "." + extension);
    }
}
