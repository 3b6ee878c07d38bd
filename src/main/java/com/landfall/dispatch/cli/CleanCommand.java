package com.landfall.dispatch.cli;

import com.landfall.deploy.ClusterDeployer;
import com.landfall.manifest.ManifestLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: landfall clean --cluster &lt;id&gt; -f &lt;path&gt;...
 */
@Command(name = "clean", mixinStandardHelpOptions = true,
        description = "Delete the objects described by the manifests")
@Component
public class CleanCommand implements Callable<Integer> {

    @Mixin
    TargetOptions target;

    private final ManifestLoader loader;
    private final ClusterDeployer deployer;

    public CleanCommand(ManifestLoader loader, ClusterDeployer deployer) {
        this.loader = loader;
        this.deployer = deployer;
    }

    @Override
    public Integer call() {
        return TargetedRun.execute(target, loader, "Cleaning",
                (cluster, manifests, cancellation) -> deployer.clean(cluster, manifests, cancellation));
    }
}
