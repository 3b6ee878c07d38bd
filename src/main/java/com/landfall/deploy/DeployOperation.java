package com.landfall.deploy;

/**
 * The two things Landfall does to a set of manifests.
 */
public enum DeployOperation {
    DEPLOY("deploy", "kubectl apply -f manifests/", true),
    CLEAN("clean", "kubectl delete -f manifests/", false);

    private final String label;
    private final String command;
    private final boolean checksStability;

    DeployOperation(String label, String command, boolean checksStability) {
        this.label = label;
        this.command = command;
        this.checksStability = checksStability;
    }

    public String label() {
        return label;
    }

    /**
     * The kubectl command run against the unpacked manifest archive.
     */
    public String command() {
        return command;
    }

    /**
     * Deletion has no notion of stability, so only deploys wait for objects to settle.
     */
    public boolean checksStability() {
        return checksStability;
    }
}
