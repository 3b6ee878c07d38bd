package com.landfall.output;

import com.landfall.core.LandfallException;

/**
 * Thrown when captured command output cannot be persisted.
 */
public class OutputCaptureException extends LandfallException {
    public OutputCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
