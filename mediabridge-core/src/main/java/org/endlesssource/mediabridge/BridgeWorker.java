package org.endlesssource.mediabridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single thread that runs engine notifications and remote commands one at a time,
 * in the order they were submitted. Submitting never blocks the caller.
 */
public final class BridgeWorker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BridgeWorker.class);
    private static final long SHUTDOWN_TIMEOUT_MS = 2000L;

    private final ExecutorService executor;

    public BridgeWorker() {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mediabridge-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Queue a task. Failures are logged and do not stop the worker.
     * @param description short label used in logs
     * @param task work to run on the worker thread
     * @return false if the worker is closed and the task was dropped
     */
    public boolean submit(String description, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    logger.error("Worker task '{}' failed", description, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("Worker closed, dropping '{}'", description);
            return false;
        }
    }

    /**
     * Wait until every task submitted before this call has run.
     * @return true if the worker drained within {@code timeout}
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        if (!submit("idle-marker", latch::countDown)) {
            return false;
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop accepting tasks and give queued ones a short grace period to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.warn("Worker did not drain within {} ms, interrupting", SHUTDOWN_TIMEOUT_MS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
