package org.endlesssource.mediabridge.jellyfin;

import okhttp3.HttpUrl;
import org.endlesssource.mediabridge.api.StreamUrlResolver;

import java.util.Objects;

/**
 * Streams items through the server's universal audio endpoint, which transcodes
 * only when the container is not directly playable.
 */
public class JellyfinStreamUrlResolver implements StreamUrlResolver {
    static final String CONTAINERS = "opus,mp3|mp3,aac,m4a|aac,m4b|aac,flac,webma,webm|webma,wav,ogg";

    private final String hostname;
    private final String token;
    private final String deviceId;

    public JellyfinStreamUrlResolver(String hostname, String token, String deviceId) {
        this.hostname = Objects.requireNonNull(hostname, "hostname must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
    }

    @Override
    public String streamUrl(String itemId) {
        return HttpUrl.get(hostname).newBuilder()
                .addPathSegment("Audio")
                .addPathSegment(itemId)
                .addPathSegment("universal")
                .addQueryParameter("api_key", token)
                .addQueryParameter("DeviceId", deviceId)
                .addQueryParameter("Container", CONTAINERS)
                .addQueryParameter("AudioCodec", "mp3")
                .addQueryParameter("TranscodingContainer", "mp3")
                .build()
                .toString();
    }
}
