package org.endlesssource.mediabridge;

import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.api.PlaybackEngineListener;
import org.endlesssource.mediabridge.api.PlaybackState;
import org.endlesssource.mediabridge.command.RemoteCommandDispatcher;
import org.endlesssource.mediabridge.config.AuthTokens;
import org.endlesssource.mediabridge.config.BridgeConfig;
import org.endlesssource.mediabridge.remote.GeneralCommand;
import org.endlesssource.mediabridge.remote.PlayRequest;
import org.endlesssource.mediabridge.remote.PlaystateCommand;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.endlesssource.mediabridge.remote.RemoteSessionClient;
import org.endlesssource.mediabridge.remote.SessionEndpoints;
import org.endlesssource.mediabridge.report.HeartbeatLoop;
import org.endlesssource.mediabridge.report.PlaybackEventTranslator;
import org.endlesssource.mediabridge.report.ProgressPayloadBuilder;
import org.endlesssource.mediabridge.session.SessionResolver;
import org.endlesssource.mediabridge.session.SessionUserManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Keeps one local playback engine and this device's session on the server in sync.
 *
 * <p>Engine notifications and server commands are funneled through a single
 * {@link BridgeWorker}; the {@link HeartbeatLoop} reports on its own thread.</p>
 */
public class SessionBridge implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SessionBridge.class);

    private final BridgeConfig config;
    private final PlaybackEngine engine;
    private final RemoteSessionClient client;
    private final String hostname;
    private final String token;
    private final BridgeWorker worker;
    private final PlaybackEventTranslator translator;
    private final RemoteCommandDispatcher dispatcher;
    private final SessionUserManager userManager;
    private final HeartbeatLoop heartbeat;
    private final PlaybackEngineListener engineListener = new EngineListener();
    private final RemoteCommandListener commandListener = new CommandListener();
    private volatile boolean started;
    private volatile boolean closed;

    /**
     * @throws BridgeStartupException if no authentication token can be found
     */
    public SessionBridge(BridgeConfig config, PlaybackEngine engine, RemoteSessionClient client) {
        this(config, engine, client, resolveHostname(config, client));
    }

    /**
     * @param hostname server base URL already passed through {@link #resolveHostname}
     * @throws BridgeStartupException if no authentication token can be found
     */
    public SessionBridge(BridgeConfig config, PlaybackEngine engine, RemoteSessionClient client, String hostname) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        Objects.requireNonNull(hostname, "hostname must not be null");
        this.hostname = SessionEndpoints.normalizeHostname(hostname);
        this.token = AuthTokens.resolve(config);

        SessionEndpoints endpoints = new SessionEndpoints(this.hostname);
        SessionResolver sessionResolver = new SessionResolver(client, endpoints, config.deviceId());
        this.translator = new PlaybackEventTranslator(client, endpoints, sessionResolver,
                new ProgressPayloadBuilder(engine));
        this.dispatcher = new RemoteCommandDispatcher(engine, config.options().getSeekSettleDelay());
        this.userManager = new SessionUserManager(client, endpoints, sessionResolver);
        this.heartbeat = new HeartbeatLoop(engine, translator, config.options().getHeartbeatInterval());
        this.worker = new BridgeWorker();
    }

    /**
     * Follows the configured server address through the client's redirect check.
     * @return the normalized base URL the server answers on
     */
    public static String resolveHostname(BridgeConfig config, RemoteSessionClient client) {
        String configured = SessionEndpoints.normalizeHostname(config.hostname());
        String redirected = SessionEndpoints.normalizeHostname(client.checkRedirect(configured));
        if (!redirected.equals(configured)) {
            logger.info("Server {} redirects to {}", configured, redirected);
        }
        return redirected;
    }

    /**
     * @return the server base URL after redirect resolution
     */
    public String getHostname() {
        return hostname;
    }

    /**
     * Connect the inbound channel, start listening to the engine and start the heartbeat.
     */
    public synchronized void start() {
        if (started || closed) {
            return;
        }
        started = true;
        client.connect(hostname, token, commandListener);
        engine.addListener(engineListener);
        heartbeat.start();

        String additionalUsers = config.additionalUsers();
        if (!additionalUsers.isEmpty()) {
            worker.submit("attach-users", () -> userManager.attachUsernames(additionalUsers));
        }
        logger.info("Session bridge started for device {} on {}", config.deviceId(), hostname);
    }

    /**
     * Wait until queued notifications and commands have been handled.
     * @see BridgeWorker#awaitIdle(java.time.Duration)
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return worker.awaitIdle(timeout);
    }

    /**
     * Report playback stopped, then release the channel. The heartbeat is dropped without waiting.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        engine.removeListener(engineListener);
        heartbeat.close();
        worker.close();
        if (started) {
            translator.reportStopped();
        }
        client.close();
        logger.info("Session bridge stopped");
    }

    private final class EngineListener implements PlaybackEngineListener {
        @Override
        public void onPlaybackStateChanged(PlaybackState oldState, PlaybackState newState) {
            worker.submit("state " + oldState + "->" + newState,
                    () -> translator.onPlaybackStateChanged(oldState, newState));
        }

        @Override
        public void onSeeked(long positionMs) {
            worker.submit("seeked " + positionMs, () -> translator.onSeeked(positionMs));
        }

        @Override
        public void onVolumeChanged(int volume) {
            worker.submit("volume " + volume, () -> translator.onVolumeChanged(volume));
        }
    }

    private final class CommandListener implements RemoteCommandListener {
        @Override
        public void onPlaystate(PlaystateCommand command) {
            worker.submit("playstate " + command.command(), () -> dispatcher.onPlaystate(command));
        }

        @Override
        public void onGeneralCommand(GeneralCommand command) {
            worker.submit("general " + command.name(), () -> dispatcher.onGeneralCommand(command));
        }

        @Override
        public void onPlayRequest(PlayRequest request) {
            worker.submit("play " + request.playCommand(), () -> dispatcher.onPlayRequest(request));
        }
    }
}
