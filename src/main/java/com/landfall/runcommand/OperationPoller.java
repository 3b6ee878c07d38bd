package com.landfall.runcommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Waits for a long-running operation to reach a terminal state.
 *
 * <p>Between polls the calling thread sleeps for the remote's Retry-After hint,
 * clamped to the configured bounds, on the caller's {@link CancellationToken}.
 * Polling stops at the first terminal observation.
 */
public class OperationPoller {

    private static final Logger log = LoggerFactory.getLogger(OperationPoller.class);

    private final CommandChannel channel;
    private final Duration defaultInterval;
    private final Duration minInterval;
    private final Duration maxInterval;

    public OperationPoller(CommandChannel channel, Duration defaultInterval,
                           Duration minInterval, Duration maxInterval) {
        if (minInterval.compareTo(maxInterval) > 0) {
            throw new IllegalArgumentException("min poll interval %s exceeds max %s".formatted(minInterval, maxInterval));
        }
        this.channel = channel;
        this.defaultInterval = defaultInterval;
        this.minInterval = minInterval;
        this.maxInterval = maxInterval;
    }

    /**
     * Blocks until the operation is terminal.
     *
     * @return the terminal result; its exit code is not judged here
     * @throws OperationCancelledException if the token fires or the thread is interrupted
     */
    public CommandResult await(OperationHandle handle, CancellationToken cancellation) {
        if (handle.isCompleted()) {
            log.debug("Operation {} completed on submit", handle.id());
            return CommandResult.from(handle.completedStatus());
        }

        var hint = handle.retryAfter();
        int polls = 0;
        while (true) {
            var delay = nextDelay(hint);
            log.debug("Operation {} running, polling in {}ms", handle.id(), delay.toMillis());
            try {
                sleep(delay, cancellation, handle);
            } catch (OperationCancelledException e) {
                log.info("Stopped waiting for operation {} after {} polls", handle.id(), polls);
                channel.abandon(handle);
                throw e;
            }

            var status = channel.poll(handle);
            polls++;
            if (status.state().isTerminal()) {
                log.debug("Operation {} reached {} after {} polls", handle.id(), status.state(), polls);
                return CommandResult.from(status);
            }
            hint = status.retryAfter();
        }
    }

    Duration nextDelay(Duration retryAfter) {
        var delay = retryAfter != null ? retryAfter : defaultInterval;
        if (delay.compareTo(minInterval) < 0) {
            return minInterval;
        }
        if (delay.compareTo(maxInterval) > 0) {
            return maxInterval;
        }
        return delay;
    }

    private static void sleep(Duration delay, CancellationToken cancellation, OperationHandle handle) {
        var what = "operation " + handle.id();
        cancellation.throwIfCancelled(what);
        try {
            if (!cancellation.sleep(delay)) {
                cancellation.throwIfCancelled(what);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted while waiting for " + what, e);
        }
    }
}
