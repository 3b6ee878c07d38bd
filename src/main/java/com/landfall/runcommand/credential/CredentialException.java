package com.landfall.runcommand.credential;

import com.landfall.core.LandfallException;

/**
 * Thrown when no credential can be obtained. Never retried.
 */
public class CredentialException extends LandfallException {
    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
