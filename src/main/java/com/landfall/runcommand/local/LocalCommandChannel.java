package com.landfall.runcommand.local;

import com.landfall.core.model.ClusterHandle;
import com.landfall.runcommand.ClusterUnreachableException;
import com.landfall.runcommand.CommandChannel;
import com.landfall.runcommand.CommandRejectedException;
import com.landfall.runcommand.CommandRequest;
import com.landfall.runcommand.OperationHandle;
import com.landfall.runcommand.OperationStatus;
import com.landfall.runcommand.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.zip.ZipInputStream;

/**
 * Runs commands on this machine instead of through the cluster's control plane,
 * for local development against a kubeconfig context.
 *
 * <p>Each command gets a fresh temp workspace with the context archive unpacked
 * into it, runs through {@code <shell> -c} on a background executor and is reported
 * as an operation like any remote command. The workspace is removed once the
 * operation's result has been collected.
 */
public class LocalCommandChannel implements CommandChannel {

    private static final Logger log = LoggerFactory.getLogger(LocalCommandChannel.class);

    private final String shell;
    private final ExecutorService executor;
    private final Map<String, Future<OperationStatus>> operations = new ConcurrentHashMap<>();

    public LocalCommandChannel(String shell, ExecutorService executor) {
        this.shell = shell;
        this.executor = executor;
    }

    @Override
    public OperationHandle submit(ClusterHandle cluster, CommandRequest request) {
        Path workspace;
        try {
            workspace = Files.createTempDirectory("landfall-run-");
        } catch (IOException e) {
            throw new ClusterUnreachableException("preparing local workspace", e);
        }
        if (request.hasContext()) {
            try {
                unpack(request.contextPayload(), workspace);
            } catch (IllegalArgumentException e) {
                deleteDirectory(workspace);
                throw new CommandRejectedException("context payload is not a base64 zip archive", e);
            } catch (IOException e) {
                deleteDirectory(workspace);
                throw new CommandRejectedException("unpacking context archive: " + e.getMessage(), e);
            }
        }

        var id = UUID.randomUUID().toString();
        operations.put(id, executor.submit(() -> execute(request.command(), workspace)));
        log.info("Started local command {} for cluster {}: {}", id, cluster.name(), request.command());
        return OperationHandle.pending(id, null, null);
    }

    @Override
    public OperationStatus poll(OperationHandle handle) {
        var future = operations.get(handle.id());
        if (future == null) {
            throw new TransportFailureException("unknown local operation " + handle.id());
        }
        if (!future.isDone()) {
            return OperationStatus.running(null);
        }
        operations.remove(handle.id());
        try {
            return future.get();
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Local operation {} failed before the command exited: {}", handle.id(), cause.getMessage());
            return OperationStatus.failed(String.valueOf(cause.getMessage()), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailureException("interrupted collecting local operation " + handle.id(), e);
        }
    }

    @Override
    public void abandon(OperationHandle handle) {
        if (operations.remove(handle.id()) != null) {
            log.info("Local operation {} abandoned; it runs to completion unobserved", handle.id());
        }
    }

    int trackedOperations() {
        return operations.size();
    }

    /**
     * Stops accepting commands and interrupts the ones still running.
     */
    public void shutdown() {
        var running = executor.shutdownNow();
        operations.clear();
        log.debug("Local command channel shut down, {} queued command(s) dropped", running.size());
    }

    private OperationStatus execute(String command, Path workspace) throws IOException, InterruptedException {
        try {
            var process = new ProcessBuilder(shell, "-c", command)
                    .directory(workspace.toFile())
                    .redirectErrorStream(true)
                    .start();
            String output;
            try (var in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            return exitCode == 0
                    ? OperationStatus.succeeded(output, 0)
                    : OperationStatus.failed(output, exitCode);
        } finally {
            deleteDirectory(workspace);
        }
    }

    static void unpack(String base64Zip, Path target) throws IOException {
        var bytes = Base64.getDecoder().decode(base64Zip);
        var root = target.toAbsolutePath().normalize();
        try (var zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            for (var entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry()) {
                var destination = root.resolve(entry.getName()).normalize();
                if (!destination.startsWith(root)) {
                    throw new IOException("archive entry escapes workspace: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.write(destination, zip.readAllBytes());
                }
            }
        }
    }

    private static void deleteDirectory(Path dir) {
        try (var walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up workspace {}: {}", dir, e.getMessage());
        }
    }
}
