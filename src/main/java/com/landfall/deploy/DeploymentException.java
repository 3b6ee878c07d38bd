package com.landfall.deploy;

import com.landfall.core.LandfallException;
import com.landfall.runcommand.OperationCancelledException;

/**
 * Thrown by {@link ClusterDeployer} when a deploy or clean does not complete.
 *
 * <p>Any such failure means the cluster may not match the submitted manifests.
 * The cause chain carries the underlying error, e.g. an
 * {@link com.landfall.stability.UnstableResourceException} naming the first unstable object.
 */
public class DeploymentException extends LandfallException {

    private final DeployOperation operation;
    private final DeployStep failedStep;

    public DeploymentException(DeployOperation operation, DeployStep failedStep, Throwable cause) {
        super("%s failed while %s: %s".formatted(operation.label(), failedStep.description(), cause.getMessage()), cause);
        this.operation = operation;
        this.failedStep = failedStep;
    }

    public DeployOperation getOperation() {
        return operation;
    }

    public DeployStep getFailedStep() {
        return failedStep;
    }

    /**
     * True when the call stopped because the caller cancelled, not because something failed.
     */
    public boolean isCancelled() {
        for (Throwable t = getCause(); t != null; t = t.getCause()) {
            if (t instanceof OperationCancelledException) {
                return true;
            }
        }
        return false;
    }
}
