package com.landfall.deploy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeployStepTest {

    @Test
    void deployPathIsValid() {
        var step = DeployStep.PACKAGING
                .transitionTo(DeployStep.SUBMITTING)
                .transitionTo(DeployStep.AWAITING_COMPLETION)
                .transitionTo(DeployStep.CHECKING_STABILITY)
                .transitionTo(DeployStep.DONE);
        assertTrue(step.isTerminal());
    }

    @Test
    void cleanSkipsStability() {
        assertTrue(DeployStep.AWAITING_COMPLETION.canTransitionTo(DeployStep.DONE));
    }

    @Test
    void stepsCannotBeSkippedOrReversed() {
        assertThrows(IllegalStateException.class, () -> DeployStep.PACKAGING.transitionTo(DeployStep.CHECKING_STABILITY));
        assertThrows(IllegalStateException.class, () -> DeployStep.CHECKING_STABILITY.transitionTo(DeployStep.SUBMITTING));
        assertThrows(IllegalStateException.class, () -> DeployStep.DONE.transitionTo(DeployStep.FAILED));
    }

    @Test
    void everyActiveStepCanFail() {
        for (var step : DeployStep.values()) {
            assertEquals(!step.isTerminal(), step.canTransitionTo(DeployStep.FAILED), step.name());
        }
    }

    @Test
    void operationsDifferOnlyInCommandAndStability() {
        assertEquals("kubectl apply -f manifests/", DeployOperation.DEPLOY.command());
        assertTrue(DeployOperation.DEPLOY.checksStability());
        assertEquals("kubectl delete -f manifests/", DeployOperation.CLEAN.command());
        assertFalse(DeployOperation.CLEAN.checksStability());
    }
}
