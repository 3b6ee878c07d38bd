package com.landfall.runcommand;

import com.landfall.core.metrics.LandfallMetrics;
import com.landfall.core.model.ClusterHandle;
import com.landfall.output.CommandOutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a command on the cluster end to end.
 *
 * <p>Flow: submit -> wait for a terminal state -> persist requested output ->
 * judge the result. Output is written before the exit code is judged so failed
 * commands keep their diagnostics.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private final CommandDispatcher dispatcher;
    private final OperationPoller poller;
    private final CommandOutputWriter outputWriter;
    private final LandfallMetrics metrics;

    public CommandRunner(CommandDispatcher dispatcher, OperationPoller poller,
                         CommandOutputWriter outputWriter, LandfallMetrics metrics) {
        this.dispatcher = dispatcher;
        this.poller = poller;
        this.outputWriter = outputWriter;
        this.metrics = metrics;
    }

    /**
     * Submits and waits for {@code request}, returning once it exited 0.
     *
     * @return the successful result, with captured logs
     */
    public CommandResult run(ClusterHandle cluster, CommandRequest request, CancellationToken cancellation) {
        var handle = submit(cluster, request, cancellation);
        return await(request, handle, cancellation);
    }

    /**
     * Submits {@code request} unless {@code cancellation} has already fired.
     * Nothing reaches the cluster once the caller has given up.
     *
     * @throws OperationCancelledException if cancelled before submission
     */
    public OperationHandle submit(ClusterHandle cluster, CommandRequest request, CancellationToken cancellation) {
        try {
            cancellation.throwIfCancelled("submission of " + request.verb());
        } catch (OperationCancelledException e) {
            metrics.recordCommand(request.verb(), "cancelled", 0);
            throw e;
        }
        return submit(cluster, request);
    }

    public OperationHandle submit(ClusterHandle cluster, CommandRequest request) {
        try {
            return dispatcher.submit(cluster, request);
        } catch (RuntimeException e) {
            metrics.recordCommand(request.verb(), "rejected", 0);
            throw e;
        }
    }

    /**
     * Waits for a submitted command and enforces the result contract.
     *
     * @throws CommandFailedException      if the command exited non-zero
     * @throws TransportFailureException   if the operation ended without a usable exit code
     * @throws OperationCancelledException if cancellation fired first
     */
    public CommandResult await(CommandRequest request, OperationHandle handle, CancellationToken cancellation) {
        long startMs = System.currentTimeMillis();
        String outcome = "error";
        try {
            var result = poller.await(handle, cancellation);
            log.info("Command finished in state {} with exit code {} ({} chars of output): {}",
                    result.state(), result.exitCode(), result.logs().length(), request.command());
            log.debug("Command output: {}", result.logs());

            if (request.capturesOutput()) {
                outputWriter.write(request.outputFile(), result.logs());
            }

            outcome = "failed";
            if (result.exitCode() == null) {
                throw new TransportFailureException(
                        "operation %s ended %s without an exit code".formatted(handle.id(), result.state()));
            }
            if (result.exitCode() != 0) {
                throw new CommandFailedException(request.command(), result.exitCode());
            }
            if (!result.isSuccess()) {
                throw new TransportFailureException(
                        "operation %s ended %s despite exit code 0".formatted(handle.id(), result.state()));
            }
            outcome = "success";
            return result;
        } catch (OperationCancelledException e) {
            outcome = "cancelled";
            throw e;
        } finally {
            metrics.recordCommand(request.verb(), outcome, System.currentTimeMillis() - startMs);
        }
    }
}
