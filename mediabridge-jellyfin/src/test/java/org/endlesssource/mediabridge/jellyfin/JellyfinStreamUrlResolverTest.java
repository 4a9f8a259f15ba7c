package org.endlesssource.mediabridge.jellyfin;

import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JellyfinStreamUrlResolverTest {

    @Test
    void streamUrl_pointsAtUniversalAudioEndpoint() {
        JellyfinStreamUrlResolver resolver = new JellyfinStreamUrlResolver("http://host:8096/jf", "tok", "dev-1");

        HttpUrl url = HttpUrl.get(resolver.streamUrl("abc123"));

        assertEquals("/jf/Audio/abc123/universal", url.encodedPath());
        assertEquals("tok", url.queryParameter("api_key"));
        assertEquals("dev-1", url.queryParameter("DeviceId"));
        assertEquals(JellyfinStreamUrlResolver.CONTAINERS, url.queryParameter("Container"));
        assertEquals("mp3", url.queryParameter("AudioCodec"));
        assertEquals("mp3", url.queryParameter("TranscodingContainer"));
    }
}
