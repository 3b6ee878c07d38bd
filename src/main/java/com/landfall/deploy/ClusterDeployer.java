package com.landfall.deploy;

import com.landfall.core.logging.MdcContext;
import com.landfall.core.metrics.LandfallMetrics;
import com.landfall.core.model.ClusterHandle;
import com.landfall.core.model.ResourceObject;
import com.landfall.manifest.ManifestPackager;
import com.landfall.runcommand.CancellationToken;
import com.landfall.runcommand.CommandRequest;
import com.landfall.runcommand.CommandRunner;
import com.landfall.stability.StabilityCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Deploys manifests to a cluster and waits for them to settle, or removes them.
 *
 * <p>Deploy: pack -> {@code kubectl apply} -> wait -> check every object's stability.
 * Clean: pack -> {@code kubectl delete} -> wait. No step is retried here; the first
 * failure ends the call with a {@link DeploymentException} naming the step.
 */
@Service
public class ClusterDeployer {

    private static final Logger log = LoggerFactory.getLogger(ClusterDeployer.class);

    private final ManifestPackager packager;
    private final CommandRunner runner;
    private final StabilityCoordinator coordinator;
    private final LandfallMetrics metrics;

    public ClusterDeployer(ManifestPackager packager, CommandRunner runner,
                           StabilityCoordinator coordinator, LandfallMetrics metrics) {
        this.packager = packager;
        this.runner = runner;
        this.coordinator = coordinator;
        this.metrics = metrics;
    }

    public void deploy(ClusterHandle cluster, List<? extends ResourceObject> objects) {
        deploy(cluster, objects, CancellationToken.create());
    }

    /**
     * Applies {@code objects} and waits until each is stable.
     *
     * @throws DeploymentException if any step fails or {@code cancellation} fires
     */
    public void deploy(ClusterHandle cluster, List<? extends ResourceObject> objects, CancellationToken cancellation) {
        execute(DeployOperation.DEPLOY, cluster, objects, cancellation);
    }

    public void clean(ClusterHandle cluster, List<? extends ResourceObject> objects) {
        clean(cluster, objects, CancellationToken.create());
    }

    /**
     * Deletes {@code objects}. Never checks stability, whatever the kinds.
     *
     * @throws DeploymentException if any step fails or {@code cancellation} fires
     */
    public void clean(ClusterHandle cluster, List<? extends ResourceObject> objects, CancellationToken cancellation) {
        execute(DeployOperation.CLEAN, cluster, objects, cancellation);
    }

    private void execute(DeployOperation operation, ClusterHandle cluster,
                         List<? extends ResourceObject> objects, CancellationToken cancellation) {
        MdcContext.setOperation(cluster.name(), operation.label());
        log.info("Starting to {} {} resources on {} (resource group {})",
                operation.label(), objects.size(), cluster.name(), cluster.resourceGroup());
        var step = DeployStep.PACKAGING;
        try {
            var archive = packager.pack(objects);
            var request = CommandRequest.withContext(operation.command(), archive.toBase64());

            step = step.transitionTo(DeployStep.SUBMITTING);
            var handle = runner.submit(cluster, request, cancellation);

            step = step.transitionTo(DeployStep.AWAITING_COMPLETION);
            runner.await(request, handle, cancellation);

            if (operation.checksStability()) {
                step = step.transitionTo(DeployStep.CHECKING_STABILITY);
                coordinator.awaitStable(cluster, objects, cancellation);
            }

            step = step.transitionTo(DeployStep.DONE);
            metrics.recordOperation(operation.label(), true, step.name());
            log.info("Finished {} of {} resources on {}", operation.label(), objects.size(), cluster.name());
        } catch (RuntimeException e) {
            var failedStep = step;
            step = step.transitionTo(DeployStep.FAILED);
            metrics.recordOperation(operation.label(), false, failedStep.name());
            log.error("{} of {} {} while {}: {}", operation.label(), cluster.name(), step.description(),
                    failedStep.description(), e.getMessage());
            throw new DeploymentException(operation, failedStep, e);
        } finally {
            MdcContext.clear();
        }
    }
}
