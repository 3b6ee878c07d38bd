package com.landfall.runcommand;

/**
 * Terminal outcome of a command: its final state, captured output and exit code.
 *
 * @param state    SUCCEEDED or FAILED
 * @param logs     captured output, never null
 * @param exitCode exit code, or null when the operation failed before the command reported one
 */
public record CommandResult(OperationState state, String logs, Integer exitCode) {

    static CommandResult from(OperationStatus status) {
        return new CommandResult(status.state(), status.logs(), status.exitCode());
    }

    /**
     * Success requires both a SUCCEEDED state and exit code 0.
     */
    public boolean isSuccess() {
        return state == OperationState.SUCCEEDED && exitCode != null && exitCode == 0;
    }
}
