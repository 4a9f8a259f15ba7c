package org.endlesssource.mediabridge.api;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conversions between remote item ids and local playable URIs.
 */
public final class TrackUris {
    public static final String SCHEME = "jellyfin";
    public static final String TYPE = "track";
    public static final String PREFIX = SCHEME + ":" + TYPE + ":";

    private TrackUris() {
    }

    public static String toUri(String itemId) {
        return PREFIX + Objects.requireNonNull(itemId, "itemId must not be null");
    }

    public static List<String> toUris(List<String> itemIds) {
        return itemIds.stream().map(TrackUris::toUri).collect(Collectors.toList());
    }

    /**
     * Extract the item id from a {@code scheme:type:id} URI.
     * @param uri local URI
     * @return the segment after the last colon, or the whole value if it has none
     */
    public static String itemId(String uri) {
        int colon = uri.lastIndexOf(':');
        return colon >= 0 ? uri.substring(colon + 1) : uri;
    }

    public static boolean isItemUri(String uri) {
        return uri != null && uri.startsWith(PREFIX);
    }
}
