package com.landfall.manifest;

import com.landfall.core.LandfallException;

/**
 * Thrown when an object cannot be rendered as JSON; packaging stops before anything is submitted.
 */
public class ManifestSerializationException extends LandfallException {
    public ManifestSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
