package org.endlesssource.mediabridge.config;

import org.endlesssource.mediabridge.BridgeStartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the authentication token the bridge talks to the server with.
 */
public final class AuthTokens {
    private static final Logger logger = LoggerFactory.getLogger(AuthTokens.class);
    public static final String TOKEN_FILE_NAME = "token";

    private AuthTokens() {
    }

    /**
     * Use the configured token, or fall back to the token file written into the cache
     * directory by the credential-issuing process.
     *
     * @param config bridge configuration
     * @return non-blank token
     * @throws BridgeStartupException if neither source provides a token
     */
    public static String resolve(BridgeConfig config) {
        if (config.token().isPresent()) {
            logger.debug("Using token from configuration");
            return config.token().get();
        }

        Path tokenFile = config.cacheDir().resolve(TOKEN_FILE_NAME);
        if (!Files.isRegularFile(tokenFile)) {
            throw new BridgeStartupException("No authentication token found");
        }
        try {
            String token = Files.readString(tokenFile, StandardCharsets.UTF_8).trim();
            if (token.isEmpty()) {
                throw new BridgeStartupException("Token file is empty: " + tokenFile);
            }
            logger.debug("Using token from {}", tokenFile);
            return token;
        } catch (IOException e) {
            throw new BridgeStartupException("Failed to read token file " + tokenFile, e);
        }
    }
}
