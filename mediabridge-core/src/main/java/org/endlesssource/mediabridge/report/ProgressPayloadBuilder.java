package org.endlesssource.mediabridge.report;

import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.api.PlaybackState;
import org.endlesssource.mediabridge.api.Track;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reads the local engine and assembles a {@link ProgressSnapshot}.
 */
public class ProgressPayloadBuilder {
    /** The server rejects queues above ~1000 entries. */
    public static final int MAX_QUEUE_ENTRIES = 950;

    private final PlaybackEngine engine;

    public ProgressPayloadBuilder(PlaybackEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * @param sessionId resolved session id
     * @return snapshot of the engine, or empty if no track is current
     */
    public Optional<ProgressSnapshot> build(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Optional<Track> current = engine.getCurrentTrack();
        if (current.isEmpty()) {
            return Optional.empty();
        }

        boolean muted = engine.isMuted();
        int volume = engine.getVolume();
        long positionTicks = ProgressSnapshot.millisToTicks(engine.getTimePosition());
        boolean paused = engine.getState() == PlaybackState.PAUSED;
        OptionalInt trackIndex = engine.getTracklistIndex();
        List<QueueEntry> queue = buildQueue(engine.getTracks());

        // current track outside the tracklist: point at the head of the queue
        String playlistItemId = QueueEntry.playlistItemId(trackIndex.orElse(0));

        return Optional.of(new ProgressSnapshot(volume, muted, paused, positionTicks, sessionId,
                current.get().itemId(), queue, playlistItemId));
    }

    static List<QueueEntry> buildQueue(List<Track> tracklist) {
        int size = Math.min(tracklist.size(), MAX_QUEUE_ENTRIES);
        List<QueueEntry> queue = new ArrayList<>(size);
        for (int index = 0; index < size; index++) {
            queue.add(QueueEntry.at(index, tracklist.get(index).itemId()));
        }
        return queue;
    }
}
