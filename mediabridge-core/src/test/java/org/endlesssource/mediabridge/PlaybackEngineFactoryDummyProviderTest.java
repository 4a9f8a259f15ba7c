package org.endlesssource.mediabridge;

import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.config.BridgeConfig;
import org.endlesssource.mediabridge.spi.EngineContext;
import org.endlesssource.mediabridge.test.DummyPlaybackEngineProvider;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PlaybackEngineFactoryDummyProviderTest {

    private static EngineContext context(BridgeConfig config) {
        return new EngineContext(config, itemId -> "http://stream/" + itemId);
    }

    private static BridgeConfig config() {
        return BridgeConfig.of("http://h", Path.of("cache"), "dev");
    }

    @Test
    void createEngine_nullContext_throws() {
        assertThrows(NullPointerException.class, () -> PlaybackEngineFactory.createEngine(null));
    }

    @Test
    void createEngine_withoutEngineId_usesFirstAvailableProvider() {
        EngineContext context = context(config());

        try (PlaybackEngine engine = PlaybackEngineFactory.createEngine(context)) {
            assertNotNull(engine);
            assertEquals("dummy", engine.getCurrentTrack().orElseThrow().itemId());
        }

        EngineContext captured = DummyPlaybackEngineProvider.consumeLastContext();
        assertSame(context, captured);
        assertEquals("http://stream/x", captured.streamUrlResolver().streamUrl("x"));
    }

    @Test
    void createEngine_requestedIdIsCaseInsensitive() {
        try (PlaybackEngine engine = PlaybackEngineFactory.createEngine(context(config().withEngineId("TEST-DUMMY")))) {
            assertNotNull(engine);
        }
        assertNotNull(DummyPlaybackEngineProvider.consumeLastContext());
    }

    @Test
    void createEngine_unknownId_throws() {
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> PlaybackEngineFactory.createEngine(context(config().withEngineId("nope"))));
        assertTrue(e.getMessage().contains("nope"));
    }

    @Test
    void createEngine_unavailableProvider_reportsReason() {
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> PlaybackEngineFactory.createEngine(context(config().withEngineId("test-offline"))));
        assertTrue(e.getMessage().contains("player not running"));
    }

    @Test
    void compiledAndRuntimeEngines_listProviders() {
        assertTrue(PlaybackEngineFactory.getCompiledEngines().contains("test-dummy"));
        assertTrue(PlaybackEngineFactory.getCompiledEngines().contains("test-offline"));
        assertTrue(PlaybackEngineFactory.getRuntimeAvailableEngines().contains("test-dummy"));
        assertFalse(PlaybackEngineFactory.getRuntimeAvailableEngines().contains("test-offline"));
    }
}
