package com.landfall.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setOperation puts cluster and operation in MDC")
    void setOperation() {
        MdcContext.setOperation("aks-east", "deploy");
        assertEquals("aks-east", MDC.get("cluster"));
        assertEquals("deploy", MDC.get("operation"));
    }

    @Test
    @DisplayName("setResource puts kind, resource and namespace in MDC")
    void setResource() {
        MdcContext.setResource("Job", "migrate", "data");
        assertEquals("Job", MDC.get("kind"));
        assertEquals("migrate", MDC.get("resource"));
        assertEquals("data", MDC.get("namespace"));
    }

    @Test
    @DisplayName("clearResource keeps the operation keys")
    void clearResource() {
        MdcContext.setOperation("aks-east", "deploy");
        MdcContext.setResource("Job", "migrate", "data");
        MdcContext.clearResource();
        assertEquals("aks-east", MDC.get("cluster"));
        assertNull(MDC.get("kind"));
        assertNull(MDC.get("resource"));
        assertNull(MDC.get("namespace"));
    }

    @Test
    @DisplayName("clear removes all landfall MDC keys")
    void clear() {
        MdcContext.setOperation("aks-east", "clean");
        MdcContext.setResource("Pod", "debug", "default");
        MdcContext.clear();
        assertNull(MDC.get("cluster"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("kind"));
        assertNull(MDC.get("resource"));
        assertNull(MDC.get("namespace"));
    }
}
