package org.endlesssource.mediabridge.config;

import org.endlesssource.mediabridge.BridgeStartupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AuthTokensTest {

    @TempDir
    Path cacheDir;

    @Test
    void configuredToken_wins() throws Exception {
        Files.writeString(cacheDir.resolve(AuthTokens.TOKEN_FILE_NAME), "from-file");
        BridgeConfig config = BridgeConfig.of("http://h", cacheDir, "dev").withToken("from-config");

        assertEquals("from-config", AuthTokens.resolve(config));
    }

    @Test
    void tokenFile_isTrimmed() throws Exception {
        Files.writeString(cacheDir.resolve("token"), "  abc123\n");

        assertEquals("abc123", AuthTokens.resolve(BridgeConfig.of("http://h", cacheDir, "dev")));
    }

    @Test
    void noToken_failsStartup() {
        BridgeStartupException e = assertThrows(BridgeStartupException.class,
                () -> AuthTokens.resolve(BridgeConfig.of("http://h", cacheDir, "dev")));
        assertEquals("No authentication token found", e.getMessage());
    }

    @Test
    void emptyTokenFile_failsStartup() throws Exception {
        Files.writeString(cacheDir.resolve("token"), "   ");

        assertThrows(BridgeStartupException.class,
                () -> AuthTokens.resolve(BridgeConfig.of("http://h", cacheDir, "dev")));
    }
}
