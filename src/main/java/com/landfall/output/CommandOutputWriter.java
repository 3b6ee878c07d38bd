package com.landfall.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Persists captured command output, one plain-text file per name.
 *
 * <p>Job logs can be long and matter most when something fails, so they go to their
 * own file instead of being interleaved with the rest of the log. Files are
 * overwritten on every run.
 */
public class CommandOutputWriter {

    private static final Logger log = LoggerFactory.getLogger(CommandOutputWriter.class);

    private final Path directory;

    public CommandOutputWriter(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Writes {@code text} to {@code fileName} inside the output directory.
     *
     * @param fileName bare file name, e.g. {@code job-migrate.log}
     * @return the file written
     * @throws IllegalArgumentException if {@code fileName} contains a path
     * @throws OutputCaptureException   if the file cannot be written
     */
    public Path write(String fileName, String text) {
        var target = resolve(fileName);
        try {
            Files.createDirectories(directory);
            Files.writeString(target, text == null ? "" : text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new OutputCaptureException("writing output file " + target, e);
        }
        log.info("Wrote command output to {} ({} chars)", target, text == null ? 0 : text.length());
        return target;
    }

    Path resolve(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("output file name is empty");
        }
        var name = Path.of(fileName);
        if (name.getNameCount() != 1 || name.isAbsolute() || "..".equals(fileName) || ".".equals(fileName)) {
            throw new IllegalArgumentException("output file must be a bare file name: " + fileName);
        }
        return directory.resolve(name);
    }
}
