package com.landfall.manifest;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestArchiveTest {

    @Test
    void entryContentIsDefensivelyCopied() {
        byte[] content = "{}".getBytes(StandardCharsets.UTF_8);
        var entry = new ManifestArchive.Entry("manifests/0.json", content);
        content[0] = 'x';
        entry.content()[1] = 'y';
        assertArrayEquals("{}".getBytes(StandardCharsets.UTF_8), entry.content());
    }

    @Test
    void entriesCompareByValue() {
        var a = new ManifestArchive.Entry("manifests/0.json", new byte[]{1, 2});
        var b = new ManifestArchive.Entry("manifests/0.json", new byte[]{1, 2});
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void archivesWithSameEntriesProduceSamePayload() {
        var entries = List.of(new ManifestArchive.Entry("manifests/0.json", new byte[]{'{', '}'}));
        assertEquals(new ManifestArchive(entries).toBase64(), new ManifestArchive(entries).toBase64());
    }

    @Test
    void emptyArchive() {
        var archive = ManifestArchive.empty();
        assertEquals(0, archive.size());
        assertTrue(archive.paths().isEmpty());
        assertTrue(archive.toZip().length > 0, "an empty zip still has an end-of-central-directory record");
    }
}
