package org.endlesssource.mediabridge.api;

import java.util.Objects;

/**
 * A playable track known to the local engine.
 *
 * @param uri   local playable URI, e.g. {@code jellyfin:track:abc123}
 * @param title display title, empty if unknown
 */
public record Track(String uri, String title) {
    public Track(String uri, String title) {
        this.uri = Objects.requireNonNull(uri, "uri must not be null");
        this.title = title == null ? "" : title;
    }

    public static Track of(String uri) {
        return new Track(uri, "");
    }

    /**
     * @return trailing segment of the URI, which is the remote item id
     */
    public String itemId() {
        return TrackUris.itemId(uri);
    }
}
