package org.endlesssource.mediabridge.jellyfin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.endlesssource.mediabridge.remote.PlaystateCommand;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.endlesssource.mediabridge.remote.SessionEndpoints;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JellyfinSessionClientTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;
    private JellyfinSessionClient client;
    private String host;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        host = SessionEndpoints.normalizeHostname(server.url("/").toString());
        client = new JellyfinSessionClient(JellyfinClientInfo.forDevice("kitchen", "dev-1"),
                Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    @Test
    void checkRedirect_followsToWebClientAndStripsIt() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/jellyfin/web/index.html"));
        server.enqueue(new MockResponse().setBody("<html></html>"));

        assertEquals(host + "/jellyfin", client.checkRedirect(host));
    }

    @Test
    void checkRedirect_unreachable_keepsConfiguredAddress() {
        assertEquals("http://127.0.0.1:1", client.checkRedirect("http://127.0.0.1:1"));
        assertEquals("not a url", client.checkRedirect("not a url"));
    }

    @Test
    void get_parsesJsonAndSendsAuthorization() throws Exception {
        server.enqueue(new MockResponse().setBody("[{\"Id\":\"S1\"}]"));

        Optional<JsonNode> body = client.get(host + "/Sessions?DeviceId=dev-1");

        assertEquals("S1", body.orElseThrow().get(0).path("Id").asText());
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/Sessions?DeviceId=dev-1", request.getPath());
        assertTrue(request.getHeader("Authorization").startsWith("MediaBrowser Client=\"mediabridge\""));
        assertFalse(request.getHeader("Authorization").contains("Token="));
    }

    @Test
    void get_httpError_isEmpty() {
        server.enqueue(new MockResponse().setResponseCode(500));
        assertTrue(client.get(host + "/Users").isEmpty());
    }

    @Test
    void post_serializesBodyAsJson() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        assertTrue(client.post(host + "/Sessions/Playing", Map.of("ItemId", "a")));

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
        assertEquals("a", MAPPER.readTree(request.getBody().readUtf8()).path("ItemId").asText());
    }

    @Test
    void post_httpError_isFalse() {
        server.enqueue(new MockResponse().setResponseCode(404));
        assertFalse(client.post(host + "/Sessions/Playing/Stopped"));
    }

    @Test
    void connect_registersCapabilitiesAndRoutesSocketCommands() throws Exception {
        BlockingQueue<String> serverFrames = new LinkedBlockingQueue<>();
        BlockingQueue<PlaystateCommand> commands = new LinkedBlockingQueue<>();

        server.enqueue(new MockResponse().setResponseCode(204));
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.send("{\"MessageType\":\"ForceKeepAlive\",\"Data\":60}");
                webSocket.send("{\"MessageType\":\"Playstate\",\"Data\":{\"Command\":\"NextTrack\"}}");
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                serverFrames.add(text);
            }
        }));

        client.connect(host, "tok", new RemoteCommandListener() {
            @Override
            public void onPlaystate(PlaystateCommand command) {
                commands.add(command);
            }
        });

        RecordedRequest capabilities = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("/Sessions/Capabilities/Full", capabilities.getPath());
        assertTrue(capabilities.getHeader("Authorization").contains("Token=\"tok\""));
        JsonNode body = MAPPER.readTree(capabilities.getBody().readUtf8());
        assertEquals("Audio", body.path("PlayableMediaTypes").get(0).asText());
        assertTrue(body.path("SupportsMediaControl").asBoolean());

        RecordedRequest upgrade = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("/socket?api_key=tok&deviceId=dev-1", upgrade.getPath());

        assertEquals(PlaystateCommand.of(PlaystateCommand.NEXT_TRACK), commands.poll(5, TimeUnit.SECONDS));
        String keepAlive = serverFrames.poll(5, TimeUnit.SECONDS);
        assertNotNull(keepAlive);
        assertEquals("KeepAlive", MAPPER.readTree(keepAlive).path("MessageType").asText());
    }
}
