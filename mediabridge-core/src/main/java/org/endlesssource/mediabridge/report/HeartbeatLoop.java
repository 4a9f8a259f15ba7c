package org.endlesssource.mediabridge.report;

import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.api.PlaybackState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Re-reports progress on a fixed delay while something is playing or paused,
 * independently of engine notifications.
 */
public class HeartbeatLoop implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HeartbeatLoop.class);

    private final PlaybackEngine engine;
    private final PlaybackEventTranslator reporter;
    private final Duration interval;
    private ScheduledExecutorService executor;

    public HeartbeatLoop(PlaybackEngine engine, PlaybackEventTranslator reporter, Duration interval) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
    }

    /**
     * Start beating; the first beat runs immediately. Calling this twice has no effect.
     */
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mediabridge-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = interval.toMillis();
        executor.scheduleWithFixedDelay(this::beatSafely, 0L, intervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Heartbeat started, interval={}", interval);
    }

    /**
     * Run one heartbeat cycle on the calling thread.
     * @return true if a progress report was sent
     */
    public boolean beat() {
        PlaybackState state = engine.getState();
        if (!state.isActive()) {
            return false;
        }
        return reporter.reportProgress(Map.of());
    }

    private void beatSafely() {
        try {
            beat();
        } catch (Exception e) {
            // keep the schedule alive, the next cycle may succeed
            logger.error("Heartbeat cycle failed", e);
        }
    }

    /**
     * Drop the schedule without waiting for an in-flight cycle.
     */
    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
