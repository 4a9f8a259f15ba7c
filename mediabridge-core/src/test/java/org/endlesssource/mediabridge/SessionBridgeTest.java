package org.endlesssource.mediabridge;

import org.endlesssource.mediabridge.api.BridgeOptions;
import org.endlesssource.mediabridge.api.PlaybackState;
import org.endlesssource.mediabridge.config.BridgeConfig;
import org.endlesssource.mediabridge.remote.GeneralCommand;
import org.endlesssource.mediabridge.remote.PlaystateCommand;
import org.endlesssource.mediabridge.remote.SessionEndpoints;
import org.endlesssource.mediabridge.test.FakePlaybackEngine;
import org.endlesssource.mediabridge.test.RecordingRemoteSessionClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionBridgeTest {
    private static final String HOST = "http://media.local";
    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path cacheDir;

    private final SessionEndpoints endpoints = new SessionEndpoints(HOST);
    private FakePlaybackEngine engine;
    private RecordingRemoteSessionClient client;
    private BridgeConfig config;

    @BeforeEach
    void setUp() {
        engine = new FakePlaybackEngine().withTracks("jellyfin:track:a", "jellyfin:track:b");
        client = new RecordingRemoteSessionClient()
                .respond(endpoints.sessionsByDevice("dev"), "[{'Id':'S1'}]");
        config = BridgeConfig.of(HOST + "/", cacheDir, "dev")
                .withToken("tok")
                .withOptions(BridgeOptions.defaults().withSeekSettleDelay(Duration.ZERO));
    }

    @Test
    void constructor_withoutToken_failsStartup() {
        BridgeStartupException e = assertThrows(BridgeStartupException.class,
                () -> new SessionBridge(BridgeConfig.of(HOST, cacheDir, "dev"), engine, client));
        assertEquals("No authentication token found", e.getMessage());
    }

    @Test
    void start_connectsWithResolvedHostAndToken() {
        client.redirectTo("https://media.example.org/jellyfin/");

        try (SessionBridge bridge = new SessionBridge(config, engine, client)) {
            bridge.start();

            assertEquals("https://media.example.org/jellyfin", bridge.getHostname());
            assertEquals("https://media.example.org/jellyfin", client.connectedHost());
            assertEquals("tok", client.connectedToken());
            assertEquals(1, engine.listenerCount());
        }
    }

    @Test
    void preResolvedHostname_skipsSecondRedirectCheck() {
        client.redirectTo("https://media.example.org/jellyfin/");
        String hostname = SessionBridge.resolveHostname(config, client);

        try (SessionBridge bridge = new SessionBridge(config, engine, client, hostname)) {
            bridge.start();

            assertEquals(1, client.redirectChecks());
            assertEquals("https://media.example.org/jellyfin", client.connectedHost());
        }
    }

    @Test
    void engineNotifications_areReported() throws Exception {
        try (SessionBridge bridge = new SessionBridge(config, engine, client)) {
            bridge.start();
            engine.playingAt(0);
            engine.fireStateChanged(PlaybackState.STOPPED, PlaybackState.PLAYING);
            engine.fireVolumeChanged(20);
            assertTrue(bridge.awaitIdle(WAIT));

            List<String> urls = client.postedUrls();
            assertTrue(urls.contains(HOST + "/Sessions/Playing"));
            assertTrue(urls.contains(HOST + "/Sessions/Playing/Progress"));
            assertTrue(urls.indexOf(HOST + "/Sessions/Playing") < urls.lastIndexOf(HOST + "/Sessions/Playing/Progress"));
        }
    }

    @Test
    void remoteCommands_reachEngine() throws Exception {
        try (SessionBridge bridge = new SessionBridge(config, engine, client)) {
            bridge.start();
            client.listener().onPlaystate(PlaystateCommand.of(PlaystateCommand.NEXT_TRACK));
            client.listener().onGeneralCommand(GeneralCommand.of(GeneralCommand.TOGGLE_MUTE));
            assertTrue(bridge.awaitIdle(WAIT));

            assertEquals(List.of("next", "mute true"), engine.commands());
        }
    }

    @Test
    void start_attachesConfiguredUsers() throws Exception {
        client.respond(endpoints.users(), "[{'Name':'alice','Id':'u1'}]");

        try (SessionBridge bridge = new SessionBridge(config.withAdditionalUsers("alice"), engine, client)) {
            bridge.start();
            assertTrue(bridge.awaitIdle(WAIT));

            assertTrue(client.postedUrls().contains(HOST + "/Sessions/S1/User/u1"));
        }
    }

    @Test
    void close_reportsStopAndReleasesClient() {
        SessionBridge bridge = new SessionBridge(config, engine, client);
        bridge.start();
        client.clear();

        bridge.close();
        bridge.close();

        assertEquals(List.of(HOST + "/Sessions/Playing/Stopped"), client.postedUrls());
        assertTrue(client.isClosed());
        assertEquals(0, engine.listenerCount());
    }

    @Test
    void close_withoutStart_sendsNothing() {
        new SessionBridge(config, engine, client).close();

        assertTrue(client.posts().isEmpty());
        assertTrue(client.isClosed());
    }
}
