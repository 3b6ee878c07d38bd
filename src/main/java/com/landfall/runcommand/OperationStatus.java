package com.landfall.runcommand;

import java.time.Duration;
import java.util.Objects;

/**
 * One observation of an operation.
 *
 * @param state      current lifecycle state
 * @param retryAfter remote-recommended delay before polling again, or null
 * @param logs       captured command output once terminal, possibly empty
 * @param exitCode   command exit code once terminal; null when the command never reported one
 */
public record OperationStatus(OperationState state, Duration retryAfter, String logs, Integer exitCode) {

    public OperationStatus {
        Objects.requireNonNull(state, "state");
        logs = logs == null ? "" : logs;
    }

    public static OperationStatus running(Duration retryAfter) {
        return new OperationStatus(OperationState.RUNNING, retryAfter, "", null);
    }

    public static OperationStatus succeeded(String logs, int exitCode) {
        return new OperationStatus(OperationState.SUCCEEDED, null, logs, exitCode);
    }

    public static OperationStatus failed(String logs, Integer exitCode) {
        return new OperationStatus(OperationState.FAILED, null, logs, exitCode);
    }
}
