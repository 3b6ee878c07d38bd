package com.landfall.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LandfallMetricsTest {

    private SimpleMeterRegistry registry;
    private LandfallMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LandfallMetrics(registry);
    }

    @Test
    @DisplayName("recordCommand creates a timer tagged by verb and outcome")
    void recordCommand() {
        metrics.recordCommand("apply", "success", 1200);
        var timer = registry.find("landfall.command.duration")
                .tag("verb", "apply").tag("outcome", "success").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordStabilityCheck counts stable and unstable separately")
    void recordStabilityCheck() {
        metrics.recordStabilityCheck("ROLLOUT_STATUS", true);
        metrics.recordStabilityCheck("ROLLOUT_STATUS", true);
        metrics.recordStabilityCheck("ROLLOUT_STATUS", false);

        var stable = registry.find("landfall.stability.checks").tag("result", "stable").counter();
        var unstable = registry.find("landfall.stability.checks").tag("result", "unstable").counter();
        assertEquals(2.0, stable.count());
        assertEquals(1.0, unstable.count());
    }

    @Test
    @DisplayName("recordOperation tags the step reached")
    void recordOperation() {
        metrics.recordOperation("deploy", false, "CHECKING_STABILITY");
        var counter = registry.find("landfall.operations.total")
                .tag("operation", "deploy").tag("result", "failure").tag("step", "CHECKING_STABILITY").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
