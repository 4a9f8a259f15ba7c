package org.endlesssource.mediabridge.jellyfin;

import okhttp3.HttpUrl;
import org.endlesssource.mediabridge.remote.SessionEndpoints;

/**
 * Derives base, socket and redirect-target URLs for a server.
 */
final class ServerUrls {
    private ServerUrls() {
    }

    /**
     * Reduce the URL a redirect check ended on to the server base URL, dropping
     * the web client path ({@code /web/index.html}), query and trailing slashes.
     */
    static String baseUrl(HttpUrl url) {
        StringBuilder base = new StringBuilder(url.scheme()).append("://").append(url.host());
        if (url.port() != HttpUrl.defaultPort(url.scheme())) {
            base.append(':').append(url.port());
        }
        String path = url.encodedPath();
        int web = path.indexOf("/web/");
        if (web >= 0) {
            path = path.substring(0, web);
        } else if (path.endsWith("/web")) {
            path = path.substring(0, path.length() - "/web".length());
        }
        return SessionEndpoints.normalizeHostname(base.append(path).toString());
    }

    /**
     * @return the socket URL for the server, {@code ws(s)://host/socket?api_key=...&deviceId=...}
     */
    static HttpUrl socketUrl(String hostname, String token, String deviceId) {
        HttpUrl base = HttpUrl.get(hostname);
        // OkHttp maps ws(s) to http(s) internally, so the socket URL is built as http(s)
        return base.newBuilder()
                .addPathSegment("socket")
                .addQueryParameter("api_key", token)
                .addQueryParameter("deviceId", deviceId)
                .build();
    }
}
