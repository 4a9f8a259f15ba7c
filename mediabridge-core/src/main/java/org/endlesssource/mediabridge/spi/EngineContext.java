package org.endlesssource.mediabridge.spi;

import org.endlesssource.mediabridge.api.StreamUrlResolver;
import org.endlesssource.mediabridge.config.BridgeConfig;

import java.util.Objects;

/**
 * Everything a provider may need to build its engine.
 */
public record EngineContext(BridgeConfig config, StreamUrlResolver streamUrlResolver) {
    public EngineContext {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(streamUrlResolver, "streamUrlResolver must not be null");
    }
}
