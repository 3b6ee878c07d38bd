package com.landfall.runcommand;

import com.landfall.core.LandfallException;

/**
 * Thrown when a command ran on the cluster and exited non-zero.
 */
public class CommandFailedException extends LandfallException {

    private final String command;
    private final int exitCode;

    public CommandFailedException(String command, int exitCode) {
        super("command failed with exit code %d: %s".formatted(exitCode, command));
        this.command = command;
        this.exitCode = exitCode;
    }

    public String getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }
}
