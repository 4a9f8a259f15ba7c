package org.endlesssource.mediabridge.config;

import org.endlesssource.mediabridge.api.BridgeOptions;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Deployment settings of one bridge instance. Immutable; use the {@code with*} methods to derive variants.
 */
public final class BridgeConfig {
    public static final String DEFAULT_DEVICE_NAME = "mediabridge";

    private final String hostname;
    private final String token;
    private final Path cacheDir;
    private final String deviceId;
    private final String deviceName;
    private final String additionalUsers;
    private final String engineId;
    private final String playerFilter;
    private final BridgeOptions options;

    private BridgeConfig(String hostname, String token, Path cacheDir, String deviceId, String deviceName,
                         String additionalUsers, String engineId, String playerFilter, BridgeOptions options) {
        this.hostname = requireText("hostname", hostname);
        this.token = blankToNull(token);
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir must not be null");
        this.deviceId = requireText("deviceId", deviceId);
        this.deviceName = requireText("deviceName", deviceName);
        this.additionalUsers = additionalUsers == null ? "" : additionalUsers.trim();
        this.engineId = blankToNull(engineId);
        this.playerFilter = playerFilter == null ? "" : playerFilter.trim();
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public static BridgeConfig of(String hostname, Path cacheDir, String deviceId) {
        return new BridgeConfig(hostname, null, cacheDir, deviceId, DEFAULT_DEVICE_NAME, "", null, "",
                BridgeOptions.defaults());
    }

    /**
     * Server base URL as configured, before redirect resolution.
     */
    public String hostname() {
        return hostname;
    }

    /**
     * Token configured directly, if any. See {@link AuthTokens#resolve(BridgeConfig)}.
     */
    public Optional<String> token() {
        return Optional.ofNullable(token);
    }

    /**
     * Directory holding artifacts of the credential-issuing process, such as the {@code token} file.
     */
    public Path cacheDir() {
        return cacheDir;
    }

    public String deviceId() {
        return deviceId;
    }

    public String deviceName() {
        return deviceName;
    }

    /**
     * Comma separated usernames to attach to the session, empty if none.
     */
    public String additionalUsers() {
        return additionalUsers;
    }

    public Optional<String> engineId() {
        return Optional.ofNullable(engineId);
    }

    /**
     * Substring matched against player bus names; empty matches any player.
     */
    public String playerFilter() {
        return playerFilter;
    }

    public BridgeOptions options() {
        return options;
    }

    public BridgeConfig withToken(String value) {
        return new BridgeConfig(hostname, value, cacheDir, deviceId, deviceName, additionalUsers, engineId,
                playerFilter, options);
    }

    public BridgeConfig withDeviceName(String value) {
        return new BridgeConfig(hostname, token, cacheDir, deviceId, value, additionalUsers, engineId,
                playerFilter, options);
    }

    public BridgeConfig withAdditionalUsers(String value) {
        return new BridgeConfig(hostname, token, cacheDir, deviceId, deviceName, value, engineId,
                playerFilter, options);
    }

    public BridgeConfig withEngineId(String value) {
        return new BridgeConfig(hostname, token, cacheDir, deviceId, deviceName, additionalUsers, value,
                playerFilter, options);
    }

    public BridgeConfig withPlayerFilter(String value) {
        return new BridgeConfig(hostname, token, cacheDir, deviceId, deviceName, additionalUsers, engineId,
                value, options);
    }

    public BridgeConfig withOptions(BridgeOptions value) {
        return new BridgeConfig(hostname, token, cacheDir, deviceId, deviceName, additionalUsers, engineId,
                playerFilter, value);
    }

    private static String requireText(String name, String value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "BridgeConfig{hostname=" + hostname
                + ", token=" + (token == null ? "<unset>" : "<set>")
                + ", cacheDir=" + cacheDir
                + ", deviceId=" + deviceId
                + ", deviceName=" + deviceName
                + ", additionalUsers=" + additionalUsers
                + ", engineId=" + engineId
                + ", playerFilter=" + playerFilter
                + ", options=" + options + '}';
    }
}
