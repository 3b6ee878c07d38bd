package com.landfall.runcommand;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "landfall")
public class RunCommandProperties {

    private Channel channel = new Channel();
    private Poll poll = new Poll();
    private Output output = new Output();
    private Local local = new Local();

    // -- delegating accessors --
    public String getProvider() { return channel.provider; }
    public Duration getPollInterval() { return poll.interval; }
    public Duration getMinPollInterval() { return poll.minInterval; }
    public Duration getMaxPollInterval() { return poll.maxInterval; }
    public String getOutputDirectory() { return output.directory; }
    public String getLocalShell() { return local.shell; }
    public int getLocalMaxParallel() { return local.maxParallel; }

    public Channel getChannel() { return channel; }
    public void setChannel(Channel channel) { this.channel = channel; }
    public Poll getPoll() { return poll; }
    public void setPoll(Poll poll) { this.poll = poll; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }
    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public static class Channel {
        /** "arm" for the managed cluster run-command API, "local" to run commands on this machine */
        private String provider = "arm";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
    }

    public static class Poll {
        /** Delay between polls when the remote gives no Retry-After */
        private Duration interval = Duration.ofSeconds(5);
        private Duration minInterval = Duration.ofSeconds(1);
        private Duration maxInterval = Duration.ofSeconds(30);

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getMinInterval() { return minInterval; }
        public void setMinInterval(Duration minInterval) { this.minInterval = minInterval; }
        public Duration getMaxInterval() { return maxInterval; }
        public void setMaxInterval(Duration maxInterval) { this.maxInterval = maxInterval; }
    }

    public static class Output {
        /** Directory captured command output (job logs) is written to */
        private String directory = ".";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Local {
        private String shell = "sh";
        private int maxParallel = 4;

        public String getShell() { return shell; }
        public void setShell(String shell) { this.shell = shell; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }
}
