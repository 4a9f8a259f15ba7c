package org.endlesssource.mediabridge.jellyfin;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class JellyfinSocketTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;
    private OkHttpClient httpClient;
    private JellyfinSocket socket;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpClient = new OkHttpClient();
        socket = new JellyfinSocket(httpClient, MAPPER, server.url("/socket"),
                new RemoteCommandListener() { }, Duration.ofMillis(100));
    }

    @AfterEach
    void tearDown() throws Exception {
        socket.close();
        httpClient.dispatcher().executorService().shutdown();
        server.shutdown();
    }

    @Test
    void serverClosingCleanly_triggersReconnect() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.close(1001, "server restarting");
            }
        }));
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() { }));

        socket.open();

        RecordedRequest first = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(first);
        RecordedRequest second = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(second, "socket was not reopened after the server closed it");
        assertEquals("/socket", second.getPath());
    }

    @Test
    void forceKeepAlive_sendsKeepAliveFramesRepeatedly() throws Exception {
        BlockingQueue<String> serverFrames = new LinkedBlockingQueue<>();
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.send("{\"MessageType\":\"ForceKeepAlive\",\"Data\":2}");
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                serverFrames.add(text);
            }
        }));

        socket.open();

        for (int i = 0; i < 2; i++) {
            String frame = serverFrames.poll(5, TimeUnit.SECONDS);
            assertNotNull(frame, "missing keep-alive frame " + i);
            assertEquals("KeepAlive", MAPPER.readTree(frame).path("MessageType").asText());
        }
    }
}
