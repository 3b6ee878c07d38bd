package com.landfall.core;

/**
 * Root of every failure Landfall raises while deploying to or cleaning a cluster.
 */
public class LandfallException extends RuntimeException {
    public LandfallException(String message) {
        super(message);
    }

    public LandfallException(String message, Throwable cause) {
        super(message, cause);
    }
}
