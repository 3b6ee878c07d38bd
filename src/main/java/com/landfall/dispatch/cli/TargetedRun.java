package com.landfall.dispatch.cli;

import com.landfall.core.LandfallException;
import com.landfall.core.model.ClusterHandle;
import com.landfall.deploy.DeploymentException;
import com.landfall.manifest.KubernetesManifest;
import com.landfall.manifest.ManifestLoader;
import com.landfall.runcommand.CancellationToken;

import java.time.Duration;
import java.util.List;

/**
 * Shared body of deploy and clean: resolve the cluster, load manifests, run, report.
 */
final class TargetedRun {

    static final int OK = 0;
    static final int FAILED = 1;

    @FunctionalInterface
    interface Action {
        void run(ClusterHandle cluster, List<KubernetesManifest> manifests, CancellationToken cancellation);
    }

    private TargetedRun() {
    }

    static int execute(TargetOptions target, ManifestLoader loader, String verb, Action action) {
        ConsoleOutput.printBanner();

        ClusterHandle cluster;
        try {
            cluster = target.cluster();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return FAILED;
        }

        List<KubernetesManifest> manifests;
        try {
            manifests = loader.load(target.sources);
        } catch (LandfallException e) {
            ConsoleOutput.error(e.getMessage());
            return FAILED;
        }

        ConsoleOutput.info("%s %d object(s) on %s".formatted(verb, manifests.size(), cluster.name()));
        manifests.forEach(m -> ConsoleOutput.resource(m.kind(), m.name(), m.effectiveNamespace()));

        var cancellation = target.timeoutSeconds > 0
                ? CancellationToken.withTimeout(Duration.ofSeconds(target.timeoutSeconds))
                : CancellationToken.create();
        try {
            action.run(cluster, manifests, cancellation);
        } catch (DeploymentException e) {
            if (e.isCancelled()) {
                ConsoleOutput.error("Cancelled while " + e.getFailedStep().description());
            }
            ConsoleOutput.error(e.getMessage());
            return FAILED;
        }
        ConsoleOutput.success("Done");
        return OK;
    }
}
