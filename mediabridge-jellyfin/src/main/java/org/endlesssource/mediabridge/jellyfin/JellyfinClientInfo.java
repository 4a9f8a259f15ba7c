package org.endlesssource.mediabridge.jellyfin;

import java.util.Objects;

/**
 * How this client identifies itself to the server.
 */
public record JellyfinClientInfo(String clientName, String clientVersion, String deviceName, String deviceId) {
    public static final String DEFAULT_CLIENT_NAME = "mediabridge";
    public static final String DEFAULT_CLIENT_VERSION = "1.0.0";

    public JellyfinClientInfo {
        Objects.requireNonNull(clientName, "clientName must not be null");
        Objects.requireNonNull(clientVersion, "clientVersion must not be null");
        Objects.requireNonNull(deviceName, "deviceName must not be null");
        Objects.requireNonNull(deviceId, "deviceId must not be null");
    }

    public static JellyfinClientInfo forDevice(String deviceName, String deviceId) {
        return new JellyfinClientInfo(DEFAULT_CLIENT_NAME, DEFAULT_CLIENT_VERSION, deviceName, deviceId);
    }

    /**
     * Value of the {@code Authorization} header.
     * @param token access token, or null before authentication
     */
    public String authorizationHeader(String token) {
        StringBuilder header = new StringBuilder("MediaBrowser ")
                .append("Client=\"").append(quote(clientName)).append("\", ")
                .append("Device=\"").append(quote(deviceName)).append("\", ")
                .append("DeviceId=\"").append(quote(deviceId)).append("\", ")
                .append("Version=\"").append(quote(clientVersion)).append('"');
        if (token != null && !token.isEmpty()) {
            header.append(", Token=\"").append(quote(token)).append('"');
        }
        return header.toString();
    }

    private static String quote(String value) {
        return value.replace("\"", "");
    }
}
