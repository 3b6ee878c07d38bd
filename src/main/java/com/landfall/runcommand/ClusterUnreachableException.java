package com.landfall.runcommand;

import com.landfall.core.LandfallException;

/**
 * Thrown when the run-command endpoint cannot be reached or answers with a server error.
 */
public class ClusterUnreachableException extends LandfallException {
    public ClusterUnreachableException(String message) {
        super(message);
    }

    public ClusterUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
