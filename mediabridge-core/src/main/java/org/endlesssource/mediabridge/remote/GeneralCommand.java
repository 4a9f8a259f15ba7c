package org.endlesssource.mediabridge.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * General command sent by the server: {@code {Name, Arguments?}}.
 */
public record GeneralCommand(String name, Map<String, String> arguments) {
    public static final String SET_VOLUME = "SetVolume";
    public static final String VOLUME_UP = "VolumeUp";
    public static final String VOLUME_DOWN = "VolumeDown";
    public static final String TOGGLE_MUTE = "ToggleMute";

    /** Commands understood by the dispatcher, advertised to the server. */
    public static final List<String> SUPPORTED = List.of(SET_VOLUME, VOLUME_UP, VOLUME_DOWN, TOGGLE_MUTE);

    public GeneralCommand {
        name = name == null ? "" : name;
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static GeneralCommand of(String name) {
        return new GeneralCommand(name, Map.of());
    }

    public Optional<String> argument(String key) {
        return Optional.ofNullable(arguments.get(key));
    }

    public static GeneralCommand fromJson(JsonNode data) {
        Map<String, String> arguments = new LinkedHashMap<>();
        data.path("Arguments").fields()
                .forEachRemaining(entry -> arguments.put(entry.getKey(), entry.getValue().asText()));
        return new GeneralCommand(data.path("Name").asText(""), arguments);
    }
}
