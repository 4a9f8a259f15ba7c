package org.endlesssource.mediabridge.session;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of attaching one configured user to the session.
 *
 * @param username name as configured
 * @param userId   server user id, empty if no user has that name
 * @param verified true if the user id was found on the session after attaching
 */
public record UserAttachment(String username, Optional<String> userId, boolean verified) {
    public UserAttachment {
        Objects.requireNonNull(username, "username must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
    }

    public boolean resolved() {
        return userId.isPresent();
    }
}
