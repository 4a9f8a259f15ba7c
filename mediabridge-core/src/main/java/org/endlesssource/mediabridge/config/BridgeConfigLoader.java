package org.endlesssource.mediabridge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.endlesssource.mediabridge.BridgeStartupException;
import org.endlesssource.mediabridge.api.BridgeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Loads {@link BridgeConfig} from a JSON file, with environment overrides for the
 * settings most often injected by service managers.
 */
public final class BridgeConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(BridgeConfigLoader.class);

    public static final String ENV_HOSTNAME = "MEDIABRIDGE_HOSTNAME";
    public static final String ENV_TOKEN = "MEDIABRIDGE_TOKEN";
    public static final String ENV_CACHE_DIR = "MEDIABRIDGE_CACHE_DIR";

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final UnaryOperator<String> environment;

    public BridgeConfigLoader() {
        this(System::getenv);
    }

    BridgeConfigLoader(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    /** On-disk shape of the configuration file. */
    static class ConfigFile {
        public String hostname;
        public String token;
        public String cacheDir;
        public String deviceId;
        public String deviceName;
        public String additionalUsers;
        public String engine;
        public String player;
        public Long heartbeatIntervalSeconds;
        public Long seekSettleDelayMillis;
        public Long enginePollIntervalMillis;
    }

    /**
     * Load the file at {@code path}. A missing file is treated as empty so a bridge can be
     * configured through the environment alone.
     *
     * @throws BridgeStartupException if the file cannot be parsed or no hostname is configured
     */
    public BridgeConfig load(Path path) {
        if (!Files.exists(path)) {
            logger.info("Config file {} not found, using environment and defaults", path);
            return toConfig(new ConfigFile());
        }
        return toConfig(readFromDisk(path));
    }

    private ConfigFile readFromDisk(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ConfigFile file = mapper.readValue(reader, ConfigFile.class);
            return file == null ? new ConfigFile() : file;
        } catch (IOException e) {
            throw new BridgeStartupException("Failed to read config file " + path, e);
        }
    }

    BridgeConfig toConfig(ConfigFile file) {
        String hostname = firstNonBlank(env(ENV_HOSTNAME), file.hostname);
        if (hostname == null) {
            throw new BridgeStartupException("No server hostname configured");
        }
        String token = firstNonBlank(env(ENV_TOKEN), file.token);
        String cacheDir = firstNonBlank(env(ENV_CACHE_DIR), file.cacheDir);
        String deviceName = firstNonBlank(file.deviceName, localHostName());
        String deviceId = firstNonBlank(file.deviceId, defaultDeviceId(deviceName));

        try {
            BridgeOptions options = BridgeOptions.defaults();
            if (file.heartbeatIntervalSeconds != null) {
                options = options.withHeartbeatInterval(Duration.ofSeconds(file.heartbeatIntervalSeconds));
            }
            if (file.seekSettleDelayMillis != null) {
                options = options.withSeekSettleDelay(Duration.ofMillis(file.seekSettleDelayMillis));
            }
            if (file.enginePollIntervalMillis != null) {
                options = options.withEnginePollInterval(Duration.ofMillis(file.enginePollIntervalMillis));
            }
            return BridgeConfig.of(hostname, cacheDir == null ? defaultCacheDir() : Path.of(cacheDir), deviceId)
                    .withToken(token)
                    .withDeviceName(deviceName)
                    .withAdditionalUsers(file.additionalUsers)
                    .withEngineId(file.engine)
                    .withPlayerFilter(file.player)
                    .withOptions(options);
        } catch (IllegalArgumentException e) {
            throw new BridgeStartupException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    static String defaultDeviceId(String deviceName) {
        return UUID.nameUUIDFromBytes(("mediabridge:" + deviceName).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static Path defaultCacheDir() {
        return Path.of(System.getProperty("user.home"), ".cache", "mediabridge");
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.debug("Unable to resolve local host name: {}", e.getMessage());
            return BridgeConfig.DEFAULT_DEVICE_NAME;
        }
    }

    private String env(String name) {
        return environment.apply(name);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return null;
    }
}
