package com.landfall.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code landfall} command line inside the Spring context.
 *
 * <p>Landfall has no server mode: every invocation is one deploy, clean or classify,
 * and its picocli exit code becomes the process exit code through
 * {@link ExitCodeGenerator}. Errors the commands do not handle themselves are
 * printed as a single line and exit with 1 instead of dumping a stack trace;
 * the trace still goes to the log at DEBUG.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final LandfallCommand landfallCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LandfallCommand landfallCommand, IFactory factory) {
        this.landfallCommand = landfallCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(landfallCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(LandfallCommand command, IFactory factory) {
        var commandLine = new CommandLine(command, factory);
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            log.debug("{} aborted", cmd.getCommandName(), e);
            ConsoleOutput.error(cmd.getCommandName() + " aborted: " + e.getMessage());
            return cmd.getCommandSpec().exitCodeOnExecutionException();
        });
        return commandLine;
    }
}
