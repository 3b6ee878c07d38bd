package com.landfall.dispatch.cli;

import com.landfall.core.model.ClusterHandle;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by deploy and clean: which cluster, which manifests, how long to wait.
 */
public class TargetOptions {

    @Option(names = {"--cluster", "-c"}, required = true,
            description = "ARM resource id of the managed cluster, e.g. "
                    + "/subscriptions/<sub>/resourceGroups/<rg>/providers/Microsoft.ContainerService/managedClusters/<name>")
    String clusterId;

    @Option(names = {"--filename", "-f"}, required = true, arity = "1..*",
            description = "Manifest files or directories (.json, .yaml, .yml)")
    List<Path> sources = new ArrayList<>();

    @Option(names = {"--timeout", "-t"},
            description = "Give up after this many seconds (0 waits indefinitely)",
            defaultValue = "0")
    long timeoutSeconds;

    ClusterHandle cluster() {
        return ClusterHandle.fromResourceId(clusterId);
    }
}
