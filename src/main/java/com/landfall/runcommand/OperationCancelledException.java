package com.landfall.runcommand;

import com.landfall.core.LandfallException;

/**
 * Thrown when the caller's cancellation fires while waiting on an operation.
 * The remote command is not retracted and may still complete.
 */
public class OperationCancelledException extends LandfallException {
    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
