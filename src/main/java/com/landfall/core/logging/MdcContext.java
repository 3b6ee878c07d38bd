package com.landfall.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Landfall-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String cluster, String operation) {
        MDC.put("cluster", cluster);
        MDC.put("operation", operation);
    }

    public static void setResource(String kind, String name, String namespace) {
        MDC.put("kind", kind);
        MDC.put("resource", name);
        MDC.put("namespace", namespace);
    }

    public static void clearResource() {
        MDC.remove("kind");
        MDC.remove("resource");
        MDC.remove("namespace");
    }

    public static void clear() {
        MDC.remove("cluster");
        MDC.remove("operation");
        clearResource();
    }
}
