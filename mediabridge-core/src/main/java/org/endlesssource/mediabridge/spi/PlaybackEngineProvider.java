package org.endlesssource.mediabridge.spi;

import org.endlesssource.mediabridge.EngineSupport;
import org.endlesssource.mediabridge.api.PlaybackEngine;

/**
 * SPI implemented by playback engine modules.
 */
public interface PlaybackEngineProvider {

    /**
     * Stable engine id, e.g. mpris.
     */
    String engineId();

    /**
     * Probe runtime availability (bus connection, running player, classes on the classpath).
     */
    EngineSupport probeSupport();

    /**
     * Create and connect the engine.
     */
    PlaybackEngine create(EngineContext context);
}
