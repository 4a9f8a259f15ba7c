package org.endlesssource.mediabridge.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediabridge.remote.RemoteSessionClient;
import org.endlesssource.mediabridge.remote.SessionEndpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up the server session that belongs to this device. Nothing is cached:
 * the server may rotate the session id between two calls.
 */
public class SessionResolver {
    private static final Logger logger = LoggerFactory.getLogger(SessionResolver.class);

    private final RemoteSessionClient client;
    private final SessionEndpoints endpoints;
    private final String deviceId;

    public SessionResolver(RemoteSessionClient client, SessionEndpoints endpoints, String deviceId) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints must not be null");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
    }

    /**
     * @return id of the first session registered for this device, or empty if there is none
     */
    public Optional<String> resolveSessionId() {
        Optional<String> sessionId = currentSession()
                .map(session -> session.path("Id").asText(""))
                .filter(id -> !id.isEmpty());
        if (sessionId.isEmpty()) {
            logger.debug("Unable to find playback session on server for device {}", deviceId);
        }
        return sessionId;
    }

    /**
     * @return ids of the users currently attached to the device's session, empty if there is no session
     */
    public Set<String> attachedUserIds() {
        Set<String> userIds = new HashSet<>();
        currentSession().ifPresent(session -> session.path("AdditionalUsers").forEach(user -> {
            String userId = user.path("UserId").asText("");
            if (!userId.isEmpty()) {
                userIds.add(userId);
            }
        }));
        return userIds;
    }

    private Optional<JsonNode> currentSession() {
        return client.get(endpoints.sessionsByDevice(deviceId))
                .filter(JsonNode::isArray)
                .filter(sessions -> sessions.size() > 0)
                .map(sessions -> sessions.get(0));
    }
}
