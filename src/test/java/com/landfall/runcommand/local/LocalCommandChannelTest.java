package com.landfall.runcommand.local;

import com.landfall.core.model.ClusterHandle;
import com.landfall.manifest.KubernetesManifest;
import com.landfall.manifest.ManifestPackager;
import com.landfall.runcommand.CancellationToken;
import com.landfall.runcommand.CommandRejectedException;
import com.landfall.runcommand.OperationCancelledException;
import com.landfall.runcommand.CommandRequest;
import com.landfall.runcommand.OperationHandle;
import com.landfall.runcommand.OperationPoller;
import com.landfall.runcommand.OperationState;
import com.landfall.runcommand.TransportFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class LocalCommandChannelTest {

    private static final ClusterHandle CLUSTER = ClusterHandle.of("sub", "rg", "kind-local");

    private ExecutorService executor;
    private LocalCommandChannel channel;
    private OperationPoller poller;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        channel = new LocalCommandChannel("sh", executor);
        poller = new OperationPoller(channel, Duration.ofMillis(10), Duration.ofMillis(5), Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("runs the command and reports its output and exit code")
    void runsCommand() {
        var handle = channel.submit(CLUSTER, CommandRequest.of("echo hello"));

        var result = poller.await(handle, CancellationToken.create());

        assertEquals(OperationState.SUCCEEDED, result.state());
        assertEquals(0, result.exitCode());
        assertEquals("hello\n", result.logs());
    }

    @Test
    @DisplayName("non-zero exit is a FAILED operation with the exit code and merged stderr")
    void failingCommand() {
        var handle = channel.submit(CLUSTER, CommandRequest.of("echo oops >&2; exit 3"));

        var result = poller.await(handle, CancellationToken.create());

        assertEquals(OperationState.FAILED, result.state());
        assertEquals(3, result.exitCode());
        assertTrue(result.logs().contains("oops"));
    }

    @Test
    @DisplayName("the context archive is unpacked into the working directory")
    void unpacksContext() {
        var archive = new ManifestPackager().pack(List.of(
                KubernetesManifest.of("v1", "ConfigMap", "a", "default"),
                KubernetesManifest.of("v1", "ConfigMap", "b", "default")));
        var handle = channel.submit(CLUSTER, CommandRequest.withContext("ls manifests", archive.toBase64()));

        var result = poller.await(handle, CancellationToken.create());

        assertEquals("0.json\n1.json\n", result.logs());
    }

    @Test
    @DisplayName("a payload that is not base64 is rejected on submit")
    void badPayload() {
        assertThrows(CommandRejectedException.class,
                () -> channel.submit(CLUSTER, CommandRequest.withContext("true", "not base64 !!")));
    }

    @Test
    @DisplayName("entries escaping the workspace are refused")
    void zipSlip(@TempDir Path dir) throws IOException {
        var buffer = new ByteArrayOutputStream();
        try (var zip = new ZipOutputStream(buffer)) {
            zip.putNextEntry(new ZipEntry("../escape.txt"));
            zip.write("x".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        var payload = Base64.getEncoder().encodeToString(buffer.toByteArray());
        var target = Files.createDirectory(dir.resolve("work"));

        assertThrows(IOException.class, () -> LocalCommandChannel.unpack(payload, target));
        assertFalse(Files.exists(dir.resolve("escape.txt")));
    }

    @Test
    @DisplayName("unknown operations cannot be polled")
    void unknownOperation() {
        assertThrows(TransportFailureException.class,
                () -> channel.poll(OperationHandle.pending("missing", null, null)));
    }

    @Test
    @DisplayName("an operation the caller stopped waiting for is no longer tracked")
    void abandonedOperationIsForgotten() {
        var handle = channel.submit(CLUSTER, CommandRequest.of("sleep 2"));

        assertThrows(OperationCancelledException.class,
                () -> poller.await(handle, CancellationToken.withTimeout(Duration.ofMillis(30))));

        assertEquals(0, channel.trackedOperations());
        assertThrows(TransportFailureException.class, () -> channel.poll(handle));
    }

    @Test
    @DisplayName("shutdown stops the executor and drops tracked operations")
    void shutdown() {
        channel.submit(CLUSTER, CommandRequest.of("sleep 2"));

        channel.shutdown();

        assertTrue(executor.isShutdown());
        assertEquals(0, channel.trackedOperations());
    }
}
