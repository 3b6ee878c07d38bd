package com.landfall.manifest;

import com.landfall.core.LandfallException;

/**
 * Thrown when manifest files cannot be read or do not describe Kubernetes objects.
 */
public class ManifestLoadException extends LandfallException {
    public ManifestLoadException(String message) {
        super(message);
    }

    public ManifestLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
