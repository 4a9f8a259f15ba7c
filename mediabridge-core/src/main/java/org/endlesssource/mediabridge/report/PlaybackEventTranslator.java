package org.endlesssource.mediabridge.report;

import org.endlesssource.mediabridge.api.PlaybackEngineListener;
import org.endlesssource.mediabridge.api.PlaybackState;
import org.endlesssource.mediabridge.remote.RemoteSessionClient;
import org.endlesssource.mediabridge.remote.SessionEndpoints;
import org.endlesssource.mediabridge.session.SessionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns local playback notifications into start, stop and progress reports.
 * Reports are best effort: a failed call is logged by the client and dropped.
 */
public class PlaybackEventTranslator implements PlaybackEngineListener {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackEventTranslator.class);

    public static final String EVENT_TIME_UPDATE = "TimeUpdate";
    public static final String EVENT_VOLUME_CHANGE = "VolumeChange";

    private final RemoteSessionClient client;
    private final SessionEndpoints endpoints;
    private final SessionResolver sessionResolver;
    private final ProgressPayloadBuilder payloadBuilder;

    public PlaybackEventTranslator(RemoteSessionClient client,
                                   SessionEndpoints endpoints,
                                   SessionResolver sessionResolver,
                                   ProgressPayloadBuilder payloadBuilder) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints must not be null");
        this.sessionResolver = Objects.requireNonNull(sessionResolver, "sessionResolver must not be null");
        this.payloadBuilder = Objects.requireNonNull(payloadBuilder, "payloadBuilder must not be null");
    }

    @Override
    public void onPlaybackStateChanged(PlaybackState oldState, PlaybackState newState) {
        logger.debug("Playback state changed {} -> {}", oldState, newState);
        if (oldState == PlaybackState.PLAYING && newState == PlaybackState.PLAYING) {
            // Track boundary: report the finished track as stopped so the server
            // scrobbles two plays instead of one long one.
            reportStopped();
        }

        if (newState == PlaybackState.PAUSED || newState == PlaybackState.PLAYING) {
            // There is no resume call; pause travels in the payload's IsPaused flag.
            currentSnapshot().ifPresent(this::reportStarted);
        } else if (newState == PlaybackState.STOPPED) {
            reportStopped();
        }
    }

    @Override
    public void onSeeked(long positionMs) {
        reportProgress(Map.of(
                "PositionTicks", ProgressSnapshot.millisToTicks(positionMs),
                "EventName", EVENT_TIME_UPDATE));
    }

    @Override
    public void onVolumeChanged(int volume) {
        reportProgress(Map.of(
                "Volume", volume,
                "EventName", EVENT_VOLUME_CHANGE));
    }

    /**
     * Resolve the session and snapshot the engine.
     * @return snapshot, or empty if there is no session or no current track
     */
    public Optional<ProgressSnapshot> currentSnapshot() {
        return sessionResolver.resolveSessionId().flatMap(payloadBuilder::build);
    }

    public boolean reportStarted(ProgressSnapshot snapshot) {
        return client.post(endpoints.playing(), snapshot.toPayload());
    }

    public boolean reportStopped() {
        return client.post(endpoints.stopped());
    }

    /**
     * Send a progress report built from a fresh snapshot, with {@code overrides} replacing
     * or adding fields.
     * @return true if a report was sent and accepted; false if there was nothing to report
     */
    public boolean reportProgress(Map<String, Object> overrides) {
        Optional<ProgressSnapshot> snapshot = currentSnapshot();
        if (snapshot.isEmpty()) {
            logger.debug("Nothing playing, dropping progress update {}", overrides);
            return false;
        }
        Map<String, Object> payload = snapshot.get().toPayload();
        payload.putAll(overrides);
        return client.post(endpoints.progress(), payload);
    }
}
