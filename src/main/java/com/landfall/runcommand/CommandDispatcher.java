package com.landfall.runcommand;

import com.landfall.core.model.ClusterHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits commands to the cluster's command channel.
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final CommandChannel channel;

    public CommandDispatcher(CommandChannel channel) {
        this.channel = channel;
    }

    /**
     * @return handle to poll for the command's outcome
     * @throws CommandRejectedException    if the command is refused
     * @throws ClusterUnreachableException if the channel cannot be reached
     */
    public OperationHandle submit(ClusterHandle cluster, CommandRequest request) {
        log.info("Submitting command to {}: {}{}", cluster.name(), request.command(),
                request.hasContext() ? " (with manifest context)" : "");
        var handle = channel.submit(cluster, request);
        log.debug("Command accepted as operation {}", handle.id());
        return handle;
    }
}
