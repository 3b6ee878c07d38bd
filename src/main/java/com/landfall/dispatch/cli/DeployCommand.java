package com.landfall.dispatch.cli;

import com.landfall.deploy.ClusterDeployer;
import com.landfall.manifest.ManifestLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: landfall deploy --cluster &lt;id&gt; -f &lt;path&gt;...
 * <p>
 * Applies the manifests and waits until every workload, pod and job is stable.
 */
@Command(name = "deploy", mixinStandardHelpOptions = true,
        description = "Apply manifests and wait for them to become stable")
@Component
public class DeployCommand implements Callable<Integer> {

    @Mixin
    TargetOptions target;

    private final ManifestLoader loader;
    private final ClusterDeployer deployer;

    public DeployCommand(ManifestLoader loader, ClusterDeployer deployer) {
        this.loader = loader;
        this.deployer = deployer;
    }

    @Override
    public Integer call() {
        return TargetedRun.execute(target, loader, "Deploying",
                (cluster, manifests, cancellation) -> deployer.deploy(cluster, manifests, cancellation));
    }
}
