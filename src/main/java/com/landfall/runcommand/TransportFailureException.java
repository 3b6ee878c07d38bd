package com.landfall.runcommand;

import com.landfall.core.LandfallException;

/**
 * Thrown when an operation ends without a usable exit code, or can no longer be tracked.
 */
public class TransportFailureException extends LandfallException {
    public TransportFailureException(String message) {
        super(message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
