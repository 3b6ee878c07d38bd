package com.landfall.stability;

/**
 * How Landfall confirms an object reached its desired state.
 */
public enum StabilityStrategy {
    /** {@code kubectl rollout status}: workloads the rollout machinery understands */
    ROLLOUT_STATUS,
    /** {@code kubectl wait --for=condition=Ready} */
    READINESS_WAIT,
    /** follow the job's logs, then wait for the Complete condition */
    JOB_COMPLETION,
    /** nothing to wait for */
    NO_CHECK
}
