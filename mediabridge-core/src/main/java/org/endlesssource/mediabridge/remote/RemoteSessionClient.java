package org.endlesssource.mediabridge.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Authenticated access to the remote media server: HTTP calls plus the
 * persistent inbound command channel. All methods are safe to call from
 * several threads.
 */
public interface RemoteSessionClient extends AutoCloseable {

    /**
     * Follow redirects from the configured server address.
     * @param hostname server base URL without trailing slash
     * @return base URL the server actually answers on; the input if the check fails
     */
    String checkRedirect(String hostname);

    /**
     * Authenticate subsequent calls with {@code token} and open the inbound channel.
     * @param hostname resolved server base URL
     * @param token authentication token
     * @param listener receiver for inbound commands
     */
    void connect(String hostname, String token, RemoteCommandListener listener);

    /**
     * @param url absolute URL
     * @return parsed response body, or empty if the call failed
     */
    Optional<JsonNode> get(String url);

    /**
     * POST without a body
     * @return true if the server accepted the call
     */
    boolean post(String url);

    /**
     * POST {@code body} serialized as JSON
     * @return true if the server accepted the call
     */
    boolean post(String url, Object body);

    /**
     * Close the inbound channel and release transport resources.
     */
    @Override
    void close();
}
