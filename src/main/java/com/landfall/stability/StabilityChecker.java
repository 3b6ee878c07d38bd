package com.landfall.stability;

import com.landfall.core.metrics.LandfallMetrics;
import com.landfall.core.model.ClusterHandle;
import com.landfall.core.model.ResourceObject;
import com.landfall.runcommand.CancellationToken;
import com.landfall.runcommand.CommandRequest;
import com.landfall.runcommand.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs the stability check matching an object's kind.
 *
 * <ul>
 *   <li>ROLLOUT_STATUS: {@code kubectl rollout status}; the cluster side bounds how long it waits</li>
 *   <li>READINESS_WAIT: {@code kubectl wait --for=condition=Ready pod/...}</li>
 *   <li>JOB_COMPLETION: follow the job's logs into {@code job-<name>.log}, then wait for Complete</li>
 *   <li>NO_CHECK: nothing</li>
 * </ul>
 */
@Service
public class StabilityChecker {

    private static final Logger log = LoggerFactory.getLogger(StabilityChecker.class);

    private final CommandRunner runner;
    private final StabilityClassifier classifier;
    private final LandfallMetrics metrics;
    private final Duration jobLogTimeout;
    private final Duration jobCompleteTimeout;
    private final Map<StabilityStrategy, StabilityCheck> checks = new EnumMap<>(StabilityStrategy.class);

    public StabilityChecker(CommandRunner runner, StabilityClassifier classifier,
                            StabilityProperties properties, LandfallMetrics metrics) {
        this.runner = runner;
        this.classifier = classifier;
        this.metrics = metrics;
        this.jobLogTimeout = properties.getJobLogTimeout();
        this.jobCompleteTimeout = properties.getJobCompleteTimeout();

        checks.put(StabilityStrategy.ROLLOUT_STATUS, this::checkRollout);
        checks.put(StabilityStrategy.READINESS_WAIT, this::checkReady);
        checks.put(StabilityStrategy.JOB_COMPLETION, this::checkJob);
        checks.put(StabilityStrategy.NO_CHECK, (cluster, object, cancellation) -> { });
    }

    /**
     * Classifies {@code object} and runs the matching check.
     *
     * @throws RuntimeException whatever the failing command raised
     */
    public void check(ClusterHandle cluster, ResourceObject object, CancellationToken cancellation) {
        var strategy = classifier.strategyFor(object.kind());
        log.info("Checking stability of {}/{} ({})", object.kind(), object.name(), strategy);
        try {
            checks.get(strategy).verify(cluster, object, cancellation);
        } catch (RuntimeException e) {
            metrics.recordStabilityCheck(strategy.name(), false);
            throw e;
        }
        metrics.recordStabilityCheck(strategy.name(), true);
    }

    private void checkRollout(ClusterHandle cluster, ResourceObject object, CancellationToken cancellation) {
        log.info("Checking rollout status");
        runner.run(cluster, CommandRequest.of(rolloutStatusCommand(object)), cancellation);
    }

    private void checkReady(ClusterHandle cluster, ResourceObject object, CancellationToken cancellation) {
        log.info("Waiting for pod to be ready");
        runner.run(cluster, CommandRequest.of(readyCommand(object)), cancellation);
    }

    private void checkJob(ClusterHandle cluster, ResourceObject object, CancellationToken cancellation) {
        log.info("Following job logs into {}", jobLogFile(object));
        runner.run(cluster, CommandRequest.capturingOutput(jobLogsCommand(object), jobLogFile(object)), cancellation);

        log.info("Checking job status");
        runner.run(cluster, CommandRequest.of(jobCompleteCommand(object)), cancellation);
    }

    static String rolloutStatusCommand(ResourceObject object) {
        return "kubectl rollout status %s/%s -n %s".formatted(object.kind(), object.name(), object.effectiveNamespace());
    }

    static String readyCommand(ResourceObject object) {
        return "kubectl wait --for=condition=Ready pod/%s -n %s".formatted(object.name(), object.effectiveNamespace());
    }

    String jobLogsCommand(ResourceObject object) {
        return "kubectl logs --pod-running-timeout=%ds --follow job/%s -n %s"
                .formatted(jobLogTimeout.toSeconds(), object.name(), object.effectiveNamespace());
    }

    String jobCompleteCommand(ResourceObject object) {
        return "kubectl wait --for=condition=complete --timeout=%ds job/%s -n %s"
                .formatted(jobCompleteTimeout.toSeconds(), object.name(), object.effectiveNamespace());
    }

    static String jobLogFile(ResourceObject object) {
        return "job-" + object.name() + ".log";
    }
}
