package org.endlesssource.mediabridge.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Transport command sent by the server: {@code {Command, SeekPositionTicks?}}.
 */
public record PlaystateCommand(String command, OptionalLong seekPositionTicks) {
    public static final String NEXT_TRACK = "NextTrack";
    public static final String PREVIOUS_TRACK = "PreviousTrack";
    public static final String PLAY_PAUSE = "PlayPause";
    public static final String STOP = "Stop";
    public static final String SEEK = "Seek";

    public PlaystateCommand {
        command = command == null ? "" : command;
        Objects.requireNonNull(seekPositionTicks, "seekPositionTicks must not be null");
    }

    public static PlaystateCommand of(String command) {
        return new PlaystateCommand(command, OptionalLong.empty());
    }

    public static PlaystateCommand seek(long ticks) {
        return new PlaystateCommand(SEEK, OptionalLong.of(ticks));
    }

    public static PlaystateCommand fromJson(JsonNode data) {
        JsonNode ticks = data.path("SeekPositionTicks");
        return new PlaystateCommand(data.path("Command").asText(""),
                ticks.canConvertToLong() ? OptionalLong.of(ticks.asLong()) : OptionalLong.empty());
    }
}
