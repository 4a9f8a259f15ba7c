package org.endlesssource.mediabridge.jellyfin;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediabridge.remote.GeneralCommand;
import org.endlesssource.mediabridge.remote.PlayRequest;
import org.endlesssource.mediabridge.remote.PlaystateCommand;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Routes socket frames of the form {@code {MessageType, Data}} to a {@link RemoteCommandListener}.
 */
final class InboundMessages {
    private static final Logger logger = LoggerFactory.getLogger(InboundMessages.class);

    static final String PLAYSTATE = "Playstate";
    static final String GENERAL_COMMAND = "GeneralCommand";
    static final String PLAY = "Play";
    static final String FORCE_KEEP_ALIVE = "ForceKeepAlive";
    static final String KEEP_ALIVE = "KeepAlive";

    private InboundMessages() {
    }

    /**
     * @return true if the frame was a command and was handed to the listener
     */
    static boolean route(JsonNode message, RemoteCommandListener listener) {
        String type = message.path("MessageType").asText("");
        JsonNode data = message.path("Data");
        switch (type) {
            case PLAYSTATE -> listener.onPlaystate(PlaystateCommand.fromJson(data));
            case GENERAL_COMMAND -> listener.onGeneralCommand(GeneralCommand.fromJson(data));
            case PLAY -> listener.onPlayRequest(PlayRequest.fromJson(data));
            default -> {
                logger.trace("Not a command frame: {}", type);
                return false;
            }
        }
        return true;
    }

    /**
     * @return keep-alive interval in seconds requested by a {@code ForceKeepAlive} frame
     */
    static OptionalInt keepAliveSeconds(JsonNode message) {
        if (!FORCE_KEEP_ALIVE.equals(message.path("MessageType").asText(""))) {
            return OptionalInt.empty();
        }
        JsonNode data = message.path("Data");
        return data.canConvertToInt() && data.asInt() > 0 ? OptionalInt.of(data.asInt()) : OptionalInt.empty();
    }

    static String keepAliveFrame() {
        return "{\"MessageType\":\"" + KEEP_ALIVE + "\"}";
    }
}
