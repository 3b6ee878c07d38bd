package com.landfall.runcommand;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned cancellation signal with an optional deadline, shared by every
 * wait of a deploy or clean call.
 *
 * <p>Cancelling wakes sleeping waiters immediately. Cancellation only stops local
 * waiting; commands already submitted keep running on the cluster.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;

    CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A token that only fires when {@link #cancel()} is called.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline) {
        return new CancellationToken(deadline, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout) {
        var clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || deadlineExpired();
    }

    public boolean deadlineExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * @throws OperationCancelledException if cancelled or past the deadline
     */
    public void throwIfCancelled(String waitingFor) {
        if (isCancelled()) {
            throw new OperationCancelledException(reason() + " while waiting for " + waitingFor);
        }
    }

    /**
     * Sleeps for up to {@code duration}, never past the deadline, waking early on cancel.
     *
     * @return true if the full duration elapsed without cancellation
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        var wait = duration;
        if (deadline != null) {
            var remaining = Duration.between(clock.instant(), deadline);
            if (remaining.compareTo(wait) < 0) {
                wait = remaining.isNegative() ? Duration.ZERO : remaining;
            }
        }
        boolean woken = cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS);
        return !woken && !isCancelled();
    }

    private String reason() {
        return cancelled.getCount() == 0 ? "cancelled" : "deadline " + deadline + " exceeded";
    }
}
