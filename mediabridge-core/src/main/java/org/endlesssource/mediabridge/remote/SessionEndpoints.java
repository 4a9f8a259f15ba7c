package org.endlesssource.mediabridge.remote;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * URLs of the session-control endpoints, relative to one server base URL.
 */
public final class SessionEndpoints {
    private final String hostname;

    public SessionEndpoints(String hostname) {
        this.hostname = Objects.requireNonNull(hostname, "hostname must not be null");
    }

    public String hostname() {
        return hostname;
    }

    public String sessionsByDevice(String deviceId) {
        return hostname + "/Sessions?DeviceId=" + URLEncoder.encode(deviceId, StandardCharsets.UTF_8);
    }

    public String users() {
        return hostname + "/Users";
    }

    public String sessionUser(String sessionId, String userId) {
        return hostname + "/Sessions/" + sessionId + "/User/" + userId;
    }

    public String playing() {
        return hostname + "/Sessions/Playing";
    }

    public String progress() {
        return hostname + "/Sessions/Playing/Progress";
    }

    public String stopped() {
        return hostname + "/Sessions/Playing/Stopped";
    }

    /**
     * Strip trailing slashes from a configured server address.
     */
    public static String normalizeHostname(String hostname) {
        String value = hostname.trim();
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
