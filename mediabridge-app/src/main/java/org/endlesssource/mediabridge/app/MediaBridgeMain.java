package org.endlesssource.mediabridge.app;

import org.endlesssource.mediabridge.BridgeStartupException;
import org.endlesssource.mediabridge.PlaybackEngineFactory;
import org.endlesssource.mediabridge.SessionBridge;
import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.config.AuthTokens;
import org.endlesssource.mediabridge.config.BridgeConfig;
import org.endlesssource.mediabridge.config.BridgeConfigLoader;
import org.endlesssource.mediabridge.jellyfin.JellyfinClientInfo;
import org.endlesssource.mediabridge.jellyfin.JellyfinSessionClient;
import org.endlesssource.mediabridge.jellyfin.JellyfinStreamUrlResolver;
import org.endlesssource.mediabridge.spi.EngineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the bridge until the JVM is asked to shut down.
 *
 * <p>Usage: {@code MediaBridgeMain [config-path]}, defaulting to {@code mediabridge.json}.</p>
 */
public final class MediaBridgeMain {
    private static final Logger logger = LoggerFactory.getLogger(MediaBridgeMain.class);
    static final String DEFAULT_CONFIG_PATH = "mediabridge.json";

    private MediaBridgeMain() {
    }

    public static void main(String[] args) {
        Path configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG_PATH);
        try {
            run(new BridgeConfigLoader().load(configPath));
        } catch (BridgeStartupException e) {
            logger.error("Startup failed: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static void run(BridgeConfig config) throws InterruptedException {
        logger.info("Starting with {}", config);
        logger.info("Compiled engines: {}", PlaybackEngineFactory.getCompiledEngines());

        String token = AuthTokens.resolve(config);
        JellyfinSessionClient client = new JellyfinSessionClient(
                JellyfinClientInfo.forDevice(config.deviceName(), config.deviceId()));
        String hostname = SessionBridge.resolveHostname(config, client);

        PlaybackEngine engine;
        try {
            engine = PlaybackEngineFactory.createEngine(new EngineContext(config,
                    new JellyfinStreamUrlResolver(hostname, token, config.deviceId())));
        } catch (RuntimeException e) {
            client.close();
            throw new BridgeStartupException("No playback engine could be started: " + e.getMessage(), e);
        }

        SessionBridge bridge = new SessionBridge(config, engine, client, hostname);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down");
            bridge.close();
            try {
                engine.close();
            } catch (Exception e) {
                logger.warn("Failed to close playback engine: {}", e.getMessage());
            }
            stopped.countDown();
        }, "mediabridge-shutdown"));

        bridge.start();
        logger.info("Connected to {}", bridge.getHostname());
        stopped.await();
    }
}
