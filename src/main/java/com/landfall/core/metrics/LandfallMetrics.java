package com.landfall.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for deployments and stability checks.
 */
@Service
public class LandfallMetrics {

    private final MeterRegistry registry;

    public LandfallMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param verb    kubectl verb, e.g. "apply", "rollout", "wait"
     * @param outcome "success", "failed", "cancelled" or "error"
     */
    public void recordCommand(String verb, String outcome, long ms) {
        Timer.builder("landfall.command.duration")
                .tag("verb", verb)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStabilityCheck(String strategy, boolean stable) {
        Counter.builder("landfall.stability.checks")
                .description("Per-object stability verifications")
                .tag("strategy", strategy)
                .tag("result", stable ? "stable" : "unstable")
                .register(registry)
                .increment();
    }

    /**
     * @param operation "deploy" or "clean"
     * @param step      the last step reached; the failing step on failure
     */
    public void recordOperation(String operation, boolean succeeded, String step) {
        Counter.builder("landfall.operations.total")
                .tag("operation", operation)
                .tag("result", succeeded ? "success" : "failure")
                .tag("step", step)
                .register(registry)
                .increment();
    }
}
