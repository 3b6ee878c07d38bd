package com.landfall.runcommand;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Opaque token for a submitted command. Only the channel that issued it knows how to poll it.
 *
 * @param id              operation id assigned by the channel
 * @param location        where the channel polls for status, or null for channels that track it in-process
 * @param retryAfter      remote-recommended delay before the first poll, or null
 * @param completedStatus set when the remote answered with a terminal result on submit
 */
public record OperationHandle(String id, URI location, Duration retryAfter, OperationStatus completedStatus) {

    public OperationHandle {
        Objects.requireNonNull(id, "id");
        if (completedStatus != null && !completedStatus.state().isTerminal()) {
            throw new IllegalArgumentException("completed status must be terminal: " + completedStatus.state());
        }
    }

    public static OperationHandle pending(String id, URI location, Duration retryAfter) {
        return new OperationHandle(id, location, retryAfter, null);
    }

    public static OperationHandle completed(String id, OperationStatus status) {
        return new OperationHandle(id, null, null, status);
    }

    public boolean isCompleted() {
        return completedStatus != null;
    }
}
