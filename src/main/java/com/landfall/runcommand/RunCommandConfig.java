package com.landfall.runcommand;

import com.landfall.core.metrics.LandfallMetrics;
import com.landfall.output.CommandOutputWriter;
import com.landfall.runcommand.local.LocalCommandChannel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RunCommandConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(name = "landfall.channel.provider", havingValue = "local")
    public LocalCommandChannel localCommandChannel(RunCommandProperties properties) {
        var counter = new AtomicInteger();
        var executor = Executors.newFixedThreadPool(properties.getLocalMaxParallel(), r -> {
            Thread t = new Thread(r, "local-command-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new LocalCommandChannel(properties.getLocalShell(), executor);
    }

    @Bean
    public CommandOutputWriter commandOutputWriter(RunCommandProperties properties) {
        return new CommandOutputWriter(Path.of(properties.getOutputDirectory()));
    }

    @Bean
    public CommandDispatcher commandDispatcher(CommandChannel channel) {
        return new CommandDispatcher(channel);
    }

    @Bean
    public OperationPoller operationPoller(CommandChannel channel, RunCommandProperties properties) {
        return new OperationPoller(channel, properties.getPollInterval(),
                properties.getMinPollInterval(), properties.getMaxPollInterval());
    }

    @Bean
    public CommandRunner commandRunner(CommandDispatcher dispatcher, OperationPoller poller,
                                       CommandOutputWriter outputWriter, LandfallMetrics metrics) {
        return new CommandRunner(dispatcher, poller, outputWriter, metrics);
    }
}
