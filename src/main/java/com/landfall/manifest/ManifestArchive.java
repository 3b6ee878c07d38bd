package com.landfall.manifest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Ordered, immutable set of manifest files shipped with a run command.
 *
 * <p>The run-command API expects its context as a base64-encoded zip; entries keep
 * the order they were added in.
 */
public final class ManifestArchive {

    /**
     * One file of the archive. The byte array is copied in and out.
     */
    public record Entry(String path, byte[] content) {
        public Entry {
            content = content.clone();
        }

        @Override
        public byte[] content() {
            return content.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Entry other && path.equals(other.path) && Arrays.equals(content, other.content);
        }

        @Override
        public int hashCode() {
            return 31 * path.hashCode() + Arrays.hashCode(content);
        }

        @Override
        public String toString() {
            return path + " (" + content.length + " bytes)";
        }
    }

    private final List<Entry> entries;
    private final byte[] zip;

    ManifestArchive(List<Entry> entries) {
        this.entries = List.copyOf(entries);
        this.zip = writeZip(this.entries);
    }

    public static ManifestArchive empty() {
        return new ManifestArchive(List.of());
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> paths() {
        var paths = new ArrayList<String>(entries.size());
        for (var entry : entries) {
            paths.add(entry.path());
        }
        return paths;
    }

    public byte[] toZip() {
        return zip.clone();
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(zip);
    }

    private static byte[] writeZip(List<Entry> entries) {
        var buffer = new ByteArrayOutputStream();
        try (var out = new ZipOutputStream(buffer)) {
            for (var entry : entries) {
                out.putNextEntry(new ZipEntry(entry.path()));
                out.write(entry.content);
                out.closeEntry();
            }
        } catch (IOException e) {
            // in-memory stream; only reachable on duplicate entry names
            throw new UncheckedIOException("writing manifest archive", e);
        }
        return buffer.toByteArray();
    }
}
