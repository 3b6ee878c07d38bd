package com.landfall.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CommandOutputWriterTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("writes into the output directory, creating it")
    void writes() throws IOException {
        var writer = new CommandOutputWriter(dir.resolve("logs"));

        var file = writer.write("job-migrate.log", "done\n");

        assertEquals(dir.resolve("logs").resolve("job-migrate.log"), file);
        assertEquals("done\n", Files.readString(file));
    }

    @Test
    @DisplayName("overwrites output from a previous run")
    void overwrites() throws IOException {
        var writer = new CommandOutputWriter(dir);
        writer.write("job-migrate.log", "a much longer first run\n");

        writer.write("job-migrate.log", "second\n");

        assertEquals("second\n", Files.readString(dir.resolve("job-migrate.log")));
    }

    @Test
    @DisplayName("null output writes an empty file")
    void nullOutput() throws IOException {
        var file = new CommandOutputWriter(dir).write("empty.log", null);
        assertEquals("", Files.readString(file));
    }

    @Test
    @DisplayName("names with path segments are rejected")
    void rejectsPaths() {
        var writer = new CommandOutputWriter(dir);
        assertThrows(IllegalArgumentException.class, () -> writer.write("../escape.log", "x"));
        assertThrows(IllegalArgumentException.class, () -> writer.write("sub/dir.log", "x"));
        assertThrows(IllegalArgumentException.class, () -> writer.write("", "x"));
    }

    @Test
    @DisplayName("an unwritable target is an output capture failure")
    void unwritable() throws IOException {
        var blocker = Files.writeString(dir.resolve("not-a-dir"), "file");
        var writer = new CommandOutputWriter(blocker);

        assertThrows(OutputCaptureException.class, () -> writer.write("job.log", "x"));
    }
}
