package com.landfall.runcommand;

import java.util.Locale;

/**
 * Lifecycle of a long-running run-command operation.
 */
public enum OperationState {
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Maps a remote provisioning state onto the local lifecycle. Unknown or in-progress
     * values ("Accepted", "Creating", ...) count as running.
     */
    public static OperationState fromProvisioningState(String provisioningState) {
        if (provisioningState == null) {
            return RUNNING;
        }
        return switch (provisioningState.toLowerCase(Locale.ROOT)) {
            case "succeeded" -> SUCCEEDED;
            case "failed", "canceled", "cancelled" -> FAILED;
            default -> RUNNING;
        };
    }
}
