package com.landfall.stability;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "landfall.stability")
public class StabilityProperties {

    /** Upper bound on concurrently running checks */
    private int maxParallel = 16;

    /** How long {@code kubectl logs --follow} waits for the job's pod to start */
    private Duration jobLogTimeout = Duration.ofSeconds(20);

    /** How long {@code kubectl wait} gives a job to report Complete once its logs ended */
    private Duration jobCompleteTimeout = Duration.ofSeconds(10);

    /** Extra kind to strategy entries, e.g. {@code kinds[Rollout]=ROLLOUT_STATUS}; brackets keep the key's case */
    private Map<String, StabilityStrategy> kinds = new HashMap<>();

    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public Duration getJobLogTimeout() { return jobLogTimeout; }
    public void setJobLogTimeout(Duration jobLogTimeout) { this.jobLogTimeout = jobLogTimeout; }
    public Duration getJobCompleteTimeout() { return jobCompleteTimeout; }
    public void setJobCompleteTimeout(Duration jobCompleteTimeout) { this.jobCompleteTimeout = jobCompleteTimeout; }
    public Map<String, StabilityStrategy> getKinds() { return kinds; }
    public void setKinds(Map<String, StabilityStrategy> kinds) { this.kinds = kinds; }
}
