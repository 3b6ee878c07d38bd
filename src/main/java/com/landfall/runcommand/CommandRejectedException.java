package com.landfall.runcommand;

import com.landfall.core.LandfallException;

/**
 * Thrown when the endpoint refuses a command synchronously, before any operation exists.
 */
public class CommandRejectedException extends LandfallException {

    private final int statusCode;

    public CommandRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CommandRejectedException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the rejection, or -1 when the request never left the process.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
