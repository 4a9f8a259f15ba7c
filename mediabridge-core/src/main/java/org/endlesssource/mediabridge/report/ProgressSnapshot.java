package org.endlesssource.mediabridge.report;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Point-in-time playback state as reported to the server.
 */
public record ProgressSnapshot(int volumeLevel,
                               boolean muted,
                               boolean paused,
                               long positionTicks,
                               String sessionId,
                               String itemId,
                               List<QueueEntry> nowPlayingQueue,
                               String playlistItemId) {
    public static final String REPEAT_MODE = "RepeatNone";
    public static final String PLAY_METHOD = "DirectPlay";

    public ProgressSnapshot {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(itemId, "itemId must not be null");
        nowPlayingQueue = List.copyOf(nowPlayingQueue);
        Objects.requireNonNull(playlistItemId, "playlistItemId must not be null");
    }

    /**
     * Positions are reported in ticks of 100 nanoseconds.
     */
    public static long millisToTicks(long millis) {
        return millis * 10_000L;
    }

    public static long ticksToMillis(long ticks) {
        return ticks / 10_000L;
    }

    /**
     * @return the request body, keyed by the server's field names
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("VolumeLevel", volumeLevel);
        payload.put("IsMuted", muted);
        payload.put("IsPaused", paused);
        payload.put("RepeatMode", REPEAT_MODE);
        payload.put("PositionTicks", positionTicks);
        payload.put("PlayMethod", PLAY_METHOD);
        payload.put("PlaySessionId", sessionId);
        payload.put("MediaSourceId", itemId);
        payload.put("CanSeek", true);
        payload.put("ItemId", itemId);
        payload.put("NowPlayingQueue", nowPlayingQueue.stream()
                .map(QueueEntry::toPayload)
                .collect(Collectors.toList()));
        payload.put("PlaylistItemId", playlistItemId);
        return payload;
    }
}
