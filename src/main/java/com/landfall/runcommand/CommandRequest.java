package com.landfall.runcommand;

import java.util.Objects;

/**
 * A command to run on the cluster through the run-command channel.
 *
 * @param command        shell command line, e.g. {@code kubectl apply -f manifests/}
 * @param contextPayload base64-encoded zip unpacked into the command's working directory, or null
 * @param outputFile     file name the captured output is written to, or null to only log it
 */
public record CommandRequest(String command, String contextPayload, String outputFile) {

    public CommandRequest {
        Objects.requireNonNull(command, "command");
        if (command.isBlank()) {
            throw new IllegalArgumentException("command is blank");
        }
    }

    public static CommandRequest of(String command) {
        return new CommandRequest(command, null, null);
    }

    public static CommandRequest withContext(String command, String contextPayload) {
        return new CommandRequest(command, contextPayload, null);
    }

    public static CommandRequest capturingOutput(String command, String outputFile) {
        return new CommandRequest(command, null, outputFile);
    }

    public boolean hasContext() {
        return contextPayload != null;
    }

    public boolean capturesOutput() {
        return outputFile != null && !outputFile.isBlank();
    }

    /**
     * The kubectl verb, used to tag metrics: {@code kubectl rollout status ...} gives "rollout".
     */
    public String verb() {
        var parts = command.trim().split("\\s+");
        if (parts.length > 1 && "kubectl".equals(parts[0])) {
            return parts[1];
        }
        return parts[0];
    }
}
