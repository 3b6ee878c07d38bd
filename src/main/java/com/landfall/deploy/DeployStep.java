package com.landfall.deploy;

import java.util.EnumSet;
import java.util.Set;

/**
 * Steps of a deploy or clean call.
 *
 * <pre>
 * PACKAGING -> SUBMITTING -> AWAITING_COMPLETION -> [CHECKING_STABILITY] -> DONE
 *           \_____________\______________________\______________________-> FAILED
 * </pre>
 */
public enum DeployStep {
    PACKAGING("packaging manifests"),
    SUBMITTING("submitting command"),
    AWAITING_COMPLETION("waiting for command to complete"),
    CHECKING_STABILITY("waiting for resources to be stable"),
    DONE("done"),
    FAILED("failed");

    private final String description;

    DeployStep(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(DeployStep next) {
        return allowedNext().contains(next);
    }

    /**
     * @throws IllegalStateException if {@code next} does not follow this step
     */
    public DeployStep transitionTo(DeployStep next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("cannot move from %s to %s".formatted(this, next));
        }
        return next;
    }

    private Set<DeployStep> allowedNext() {
        return switch (this) {
            case PACKAGING -> EnumSet.of(SUBMITTING, FAILED);
            case SUBMITTING -> EnumSet.of(AWAITING_COMPLETION, FAILED);
            case AWAITING_COMPLETION -> EnumSet.of(CHECKING_STABILITY, DONE, FAILED);
            case CHECKING_STABILITY -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(DeployStep.class);
        };
    }
}
