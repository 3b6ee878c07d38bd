package com.landfall.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Landfall.
 * Routes to subcommands: deploy, clean, classify.
 */
@Command(
        name = "landfall",
        mixinStandardHelpOptions = true,
        version = "Landfall 0.1.0",
        description = "Deploys Kubernetes manifests to managed clusters through the run-command API",
        subcommands = {
                DeployCommand.class,
                CleanCommand.class,
                ClassifyCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LandfallCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
