package org.endlesssource.mediabridge;

import java.util.Objects;

/**
 * Availability information for a playback engine provider.
 */
public record EngineSupport(String engine, boolean available, String reason) {
    public EngineSupport(String engine, boolean available, String reason) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.available = available;
        this.reason = reason == null ? "" : reason;
    }

    public static EngineSupport available(String engine) {
        return new EngineSupport(engine, true, "");
    }

    public static EngineSupport unavailable(String engine, String reason) {
        return new EngineSupport(engine, false, reason);
    }
}
