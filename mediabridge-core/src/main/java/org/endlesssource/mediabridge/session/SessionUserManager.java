package org.endlesssource.mediabridge.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediabridge.remote.RemoteSessionClient;
import org.endlesssource.mediabridge.remote.SessionEndpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Attaches extra server users to this device's session so that playback
 * shows up in their activity as well.
 */
public class SessionUserManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionUserManager.class);

    private final RemoteSessionClient client;
    private final SessionEndpoints endpoints;
    private final SessionResolver sessionResolver;

    public SessionUserManager(RemoteSessionClient client, SessionEndpoints endpoints, SessionResolver sessionResolver) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints must not be null");
        this.sessionResolver = Objects.requireNonNull(sessionResolver, "sessionResolver must not be null");
    }

    /**
     * Split a comma separated username list, trimming blanks.
     */
    public static List<String> parseUsernames(String usernames) {
        if (usernames == null || usernames.isBlank()) {
            return List.of();
        }
        return Arrays.stream(usernames.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Attach every user named in a comma separated list.
     * @see #attachUsers(List)
     */
    public List<UserAttachment> attachUsernames(String usernames) {
        return attachUsers(parseUsernames(usernames));
    }

    /**
     * Resolve the names to user ids, attach the resolved ones to the current session,
     * then re-read the session to check which attachments took.
     *
     * @param usernames usernames, matched case-insensitively
     * @return one entry per username, in input order; empty if there is no session
     */
    public List<UserAttachment> attachUsers(List<String> usernames) {
        Optional<String> sessionId = sessionResolver.resolveSessionId();
        if (sessionId.isEmpty()) {
            logger.info("No session to attach users {} to", usernames);
            return List.of();
        }

        Map<String, Optional<String>> userIds = resolveUserIds(usernames);
        userIds.forEach((username, userId) -> {
            if (userId.isEmpty()) {
                logger.warn("User ID not found for username: {}", username);
                return;
            }
            client.post(endpoints.sessionUser(sessionId.get(), userId.get()));
        });

        Set<String> sessionUsers = sessionResolver.attachedUserIds();
        List<UserAttachment> attachments = new ArrayList<>(userIds.size());
        userIds.forEach((username, userId) -> {
            boolean verified = userId.map(sessionUsers::contains).orElse(false);
            if (userId.isPresent()) {
                if (verified) {
                    logger.info("Successfully added user {} to the session", username);
                } else {
                    logger.warn("Failed to add user {} to the session", username);
                }
            }
            attachments.add(new UserAttachment(username, userId, verified));
        });
        return attachments;
    }

    Map<String, Optional<String>> resolveUserIds(List<String> usernames) {
        Map<String, String> idsByName = new HashMap<>();
        client.get(endpoints.users())
                .filter(JsonNode::isArray)
                .ifPresent(users -> users.forEach(user -> {
                    String name = user.path("Name").asText("");
                    String id = user.path("Id").asText("");
                    if (!name.isEmpty() && !id.isEmpty()) {
                        idsByName.put(name.toLowerCase(Locale.ROOT), id);
                    }
                }));

        Map<String, Optional<String>> resolved = new LinkedHashMap<>();
        for (String username : usernames) {
            resolved.put(username, Optional.ofNullable(idsByName.get(username.toLowerCase(Locale.ROOT))));
        }
        return resolved;
    }
}
