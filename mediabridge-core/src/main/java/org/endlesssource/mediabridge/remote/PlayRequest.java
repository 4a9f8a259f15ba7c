package org.endlesssource.mediabridge.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Queue ("play to") command sent by the server:
 * {@code {ItemIds, PlayCommand, StartIndex?, StartPositionTicks?}}.
 */
public record PlayRequest(List<String> itemIds,
                          String playCommand,
                          OptionalInt startIndex,
                          OptionalLong startPositionTicks) {
    public static final String PLAY_NOW = "PlayNow";
    public static final String PLAY_LAST = "PlayLast";
    public static final String PLAY_NEXT = "PlayNext";

    public PlayRequest {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
        playCommand = playCommand == null ? "" : playCommand;
        Objects.requireNonNull(startIndex, "startIndex must not be null");
        Objects.requireNonNull(startPositionTicks, "startPositionTicks must not be null");
    }

    public static PlayRequest fromJson(JsonNode data) {
        List<String> itemIds = new ArrayList<>();
        data.path("ItemIds").forEach(id -> itemIds.add(id.asText()));
        JsonNode startIndex = data.path("StartIndex");
        JsonNode startTicks = data.path("StartPositionTicks");
        return new PlayRequest(itemIds,
                data.path("PlayCommand").asText(""),
                startIndex.canConvertToInt() ? OptionalInt.of(startIndex.asInt()) : OptionalInt.empty(),
                startTicks.canConvertToLong() ? OptionalLong.of(startTicks.asLong()) : OptionalLong.empty());
    }
}
