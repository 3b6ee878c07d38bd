package com.landfall.runcommand;

import com.landfall.core.model.ClusterHandle;

/**
 * The cluster's asynchronous command-execution endpoint.
 * Implementations: ArmRunCommandChannel (managed cluster API), LocalCommandChannel (dev).
 */
public interface CommandChannel {

    /**
     * Starts a command on the cluster.
     *
     * @return handle to the long-running operation
     * @throws CommandRejectedException   if the endpoint rejects the request outright
     * @throws ClusterUnreachableException if the endpoint cannot be reached
     */
    OperationHandle submit(ClusterHandle cluster, CommandRequest request);

    /**
     * Fetches the current status of an operation once, without waiting.
     */
    OperationStatus poll(OperationHandle handle);

    /**
     * Called when the caller stops waiting for an operation before it finished.
     * The operation itself keeps running; only local tracking is released.
     */
    default void abandon(OperationHandle handle) {
    }
}
