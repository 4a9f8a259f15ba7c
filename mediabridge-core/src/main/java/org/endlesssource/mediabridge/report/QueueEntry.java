package org.endlesssource.mediabridge.report;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the reported play queue.
 *
 * @param itemId         remote item id
 * @param playlistItemId positional queue-slot id, {@code playlistItem{index}}
 */
public record QueueEntry(String itemId, String playlistItemId) {
    public QueueEntry {
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(playlistItemId, "playlistItemId must not be null");
    }

    public static QueueEntry at(int index, String itemId) {
        return new QueueEntry(itemId, playlistItemId(index));
    }

    public static String playlistItemId(int index) {
        return "playlistItem" + index;
    }

    Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Id", itemId);
        payload.put("PlaylistItemId", playlistItemId);
        return payload;
    }
}
