package com.landfall.stability;

import org.springframework.beans.factory.annotation.Autowired;
import com.landfall.core.logging.MdcContext;
import com.landfall.core.model.ClusterHandle;
import com.landfall.core.model.ResourceObject;
import com.landfall.runcommand.CancellationToken;
import com.landfall.runcommand.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Checks every object concurrently and reports the first one that failed.
 *
 * <p>Each object gets its own task on a pool bounded at {@code maxParallel}; there is
 * no ordering between objects. All tasks are joined even after a failure, and running
 * siblings are left to finish. Only the first failure (in completion order) is
 * propagated; later failures are logged and counted.
 */
@Service
public class StabilityCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StabilityCoordinator.class);

    private final StabilityChecker checker;
    private final int maxParallel;

    @Autowired
    public StabilityCoordinator(StabilityChecker checker, StabilityProperties properties) {
        this(checker, properties.getMaxParallel());
    }

    StabilityCoordinator(StabilityChecker checker, int maxParallel) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, was " + maxParallel);
        }
        this.checker = checker;
        this.maxParallel = maxParallel;
    }

    /**
     * Blocks until every object has been checked.
     *
     * @throws UnstableResourceException   naming the first object whose check failed
     * @throws OperationCancelledException if the calling thread is interrupted while joining
     */
    public void awaitStable(ClusterHandle cluster, List<? extends ResourceObject> objects,
                            CancellationToken cancellation) {
        if (objects.isEmpty()) {
            log.info("No objects to check for stability");
            return;
        }
        log.info("Starting to wait for {} objects to be stable", objects.size());

        var firstFailure = new AtomicReference<FailedCheck>();
        var additionalFailures = new AtomicInteger();
        var callerContext = MDC.getCopyOfContextMap();

        ExecutorService executor = newExecutor(Math.min(maxParallel, objects.size()));
        try {
            var futures = new ArrayList<CompletableFuture<Void>>(objects.size());
            for (var object : objects) {
                futures.add(CompletableFuture.runAsync(
                        () -> checkOne(cluster, object, cancellation, callerContext, firstFailure, additionalFailures),
                        executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new OperationCancelledException("interrupted while waiting for stability checks", e);
        } catch (ExecutionException e) {
            // checkOne records every RuntimeException; anything reaching here is an Error
            throw new IllegalStateException("stability check task died", e.getCause());
        } finally {
            executor.shutdown();
        }

        var failure = firstFailure.get();
        if (failure != null) {
            int others = additionalFailures.get();
            if (others > 0) {
                log.warn("{} further object(s) also failed their stability check; reporting {}",
                        others, failure.object().describe());
            }
            throw new UnstableResourceException(failure.object(), others, failure.error());
        }
        log.info("All {} objects are stable", objects.size());
    }

    private void checkOne(ClusterHandle cluster, ResourceObject object, CancellationToken cancellation,
                          Map<String, String> callerContext,
                          AtomicReference<FailedCheck> firstFailure, AtomicInteger additionalFailures) {
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MdcContext.setResource(object.kind(), object.name(), object.effectiveNamespace());
        try {
            checker.check(cluster, object, cancellation);
        } catch (RuntimeException e) {
            if (firstFailure.compareAndSet(null, new FailedCheck(object, e))) {
                log.error("Stability check failed for {}: {}", object.describe(), e.getMessage());
            } else {
                additionalFailures.incrementAndGet();
                log.warn("Stability check also failed for {} (not reported): {}", object.describe(), e.getMessage());
            }
        } finally {
            MDC.clear();
        }
    }

    private static ExecutorService newExecutor(int threads) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "stability-check-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private record FailedCheck(ResourceObject object, RuntimeException error) {}
}
