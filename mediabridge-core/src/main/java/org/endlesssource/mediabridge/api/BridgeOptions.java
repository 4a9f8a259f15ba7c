package org.endlesssource.mediabridge.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing options for the bridge and its engines.
 */
public final class BridgeOptions {
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SEEK_SETTLE_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_ENGINE_POLL_INTERVAL = Duration.ofMillis(200);

    private final Duration heartbeatInterval;
    private final Duration seekSettleDelay;
    private final Duration enginePollInterval;

    private BridgeOptions(Duration heartbeatInterval,
                          Duration seekSettleDelay,
                          Duration enginePollInterval) {
        this.heartbeatInterval = requirePositive("heartbeatInterval", heartbeatInterval);
        this.seekSettleDelay = requireNonNegative("seekSettleDelay", seekSettleDelay);
        this.enginePollInterval = requirePositive("enginePollInterval", enginePollInterval);
    }

    public static BridgeOptions defaults() {
        return new BridgeOptions(DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_SEEK_SETTLE_DELAY, DEFAULT_ENGINE_POLL_INTERVAL);
    }

    /**
     * Interval between two progress re-reports while something is playing or paused.
     */
    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * Wait between starting playback from a queue command and seeking to its start position.
     * The engine drops seeks issued before playback has settled.
     */
    public Duration getSeekSettleDelay() {
        return seekSettleDelay;
    }

    public Duration getEnginePollInterval() {
        return enginePollInterval;
    }

    public BridgeOptions withHeartbeatInterval(Duration interval) {
        return new BridgeOptions(interval, seekSettleDelay, enginePollInterval);
    }

    public BridgeOptions withSeekSettleDelay(Duration delay) {
        return new BridgeOptions(heartbeatInterval, delay, enginePollInterval);
    }

    public BridgeOptions withEnginePollInterval(Duration interval) {
        return new BridgeOptions(heartbeatInterval, seekSettleDelay, interval);
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration requireNonNegative(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }

    @Override
    public String toString() {
        return "BridgeOptions{heartbeatInterval=" + heartbeatInterval
                + ", seekSettleDelay=" + seekSettleDelay
                + ", enginePollInterval=" + enginePollInterval + '}';
    }
}
