package org.endlesssource.mediabridge.jellyfin;

import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ServerUrlsTest {

    @Test
    void baseUrl_dropsWebClientPath() {
        assertEquals("https://media.example.org",
                ServerUrls.baseUrl(HttpUrl.get("https://media.example.org/web/index.html#!/home")));
        assertEquals("http://10.0.0.5:8096/jellyfin",
                ServerUrls.baseUrl(HttpUrl.get("http://10.0.0.5:8096/jellyfin/web/index.html")));
        assertEquals("http://10.0.0.5:8096",
                ServerUrls.baseUrl(HttpUrl.get("http://10.0.0.5:8096/web")));
    }

    @Test
    void baseUrl_keepsPlainPath() {
        assertEquals("http://host:8096/jellyfin", ServerUrls.baseUrl(HttpUrl.get("http://host:8096/jellyfin/")));
        assertEquals("http://host", ServerUrls.baseUrl(HttpUrl.get("http://host:80/")));
    }

    @Test
    void socketUrl_carriesTokenAndDevice() {
        HttpUrl url = ServerUrls.socketUrl("https://media.example.org/jellyfin", "tok", "dev 1");

        assertEquals("/jellyfin/socket", url.encodedPath());
        assertEquals("tok", url.queryParameter("api_key"));
        assertEquals("dev 1", url.queryParameter("deviceId"));
        assertEquals("https", url.scheme());
    }
}
