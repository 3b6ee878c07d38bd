package com.landfall.stability;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps resource kinds to {@link StabilityStrategy stability strategies}.
 *
 * <p>The default table covers the workload kinds {@code kubectl rollout status}
 * supports, plain pods and jobs; every other kind needs no check. Instances may
 * register extra kinds on top of the defaults, e.g. custom resources that
 * support rollout status.
 */
public final class StabilityClassifier {

    private static final Map<String, StabilityStrategy> DEFAULTS = Map.of(
            "Deployment", StabilityStrategy.ROLLOUT_STATUS,
            "StatefulSet", StabilityStrategy.ROLLOUT_STATUS,
            "DaemonSet", StabilityStrategy.ROLLOUT_STATUS,
            "Pod", StabilityStrategy.READINESS_WAIT,
            "Job", StabilityStrategy.JOB_COMPLETION
    );

    private final Map<String, StabilityStrategy> table;

    private StabilityClassifier(Map<String, StabilityStrategy> table) {
        this.table = Map.copyOf(table);
    }

    public static StabilityClassifier defaults() {
        return new StabilityClassifier(DEFAULTS);
    }

    /**
     * A classifier with {@code extraKinds} added to, or overriding, the defaults.
     */
    public static StabilityClassifier withKinds(Map<String, StabilityStrategy> extraKinds) {
        var table = new HashMap<>(DEFAULTS);
        table.putAll(extraKinds);
        return new StabilityClassifier(table);
    }

    /**
     * Default classification. Kind names are matched exactly; unknown or missing kinds give NO_CHECK.
     */
    public static StabilityStrategy classify(String kind) {
        return kind == null ? StabilityStrategy.NO_CHECK : DEFAULTS.getOrDefault(kind, StabilityStrategy.NO_CHECK);
    }

    public StabilityStrategy strategyFor(String kind) {
        return kind == null ? StabilityStrategy.NO_CHECK : table.getOrDefault(kind, StabilityStrategy.NO_CHECK);
    }

    public Map<String, StabilityStrategy> registeredKinds() {
        return table;
    }
}
