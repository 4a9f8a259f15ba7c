package org.endlesssource.mediabridge.api;

import java.util.Objects;

/**
 * A track as it sits in the engine's tracklist.
 *
 * @param tlid  engine-assigned tracklist id, stable while the entry stays in the list
 * @param track the track
 */
public record TracklistEntry(long tlid, Track track) {
    public TracklistEntry {
        Objects.requireNonNull(track, "track must not be null");
    }
}
