package org.endlesssource.mediabridge.test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.endlesssource.mediabridge.remote.RemoteSessionClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Client double that answers GETs from canned JSON and records every POST.
 */
public final class RecordingRemoteSessionClient implements RemoteSessionClient {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** A recorded POST; {@code payload} is null when no body was sent. */
    public record Post(String url, Map<String, Object> payload) {
    }

    private final Map<String, Supplier<JsonNode>> responses = new ConcurrentHashMap<>();
    private final List<Post> posts = new CopyOnWriteArrayList<>();
    private final List<String> gets = new CopyOnWriteArrayList<>();
    private final AtomicInteger redirectChecks = new AtomicInteger();
    private volatile String redirectTarget;
    private volatile RemoteCommandListener listener;
    private volatile String connectedHost;
    private volatile String connectedToken;
    private volatile boolean closed;

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text.replace('\'', '"'));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /** Canned response; single quotes in {@code jsonText} stand for double quotes. */
    public RecordingRemoteSessionClient respond(String url, String jsonText) {
        JsonNode node = json(jsonText);
        responses.put(url, () -> node);
        return this;
    }

    public RecordingRemoteSessionClient respond(String url, Supplier<JsonNode> response) {
        responses.put(url, response);
        return this;
    }

    public RecordingRemoteSessionClient redirectTo(String hostname) {
        redirectTarget = hostname;
        return this;
    }

    public List<Post> posts() {
        return List.copyOf(posts);
    }

    public List<String> postedUrls() {
        return posts.stream().map(Post::url).toList();
    }

    public List<String> gets() {
        return List.copyOf(gets);
    }

    public void clear() {
        posts.clear();
        gets.clear();
    }

    public RemoteCommandListener listener() {
        return listener;
    }

    public String connectedHost() {
        return connectedHost;
    }

    public String connectedToken() {
        return connectedToken;
    }

    public int redirectChecks() {
        return redirectChecks.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String checkRedirect(String hostname) {
        redirectChecks.incrementAndGet();
        return redirectTarget == null ? hostname : redirectTarget;
    }

    @Override
    public void connect(String hostname, String token, RemoteCommandListener commandListener) {
        connectedHost = hostname;
        connectedToken = token;
        listener = commandListener;
    }

    @Override
    public Optional<JsonNode> get(String url) {
        gets.add(url);
        Supplier<JsonNode> response = responses.get(url);
        return response == null ? Optional.empty() : Optional.ofNullable(response.get());
    }

    @Override
    public boolean post(String url) {
        posts.add(new Post(url, null));
        return true;
    }

    @Override
    public boolean post(String url, Object body) {
        if (!(body instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Expected a map body but got " + body);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        map.forEach((key, value) -> payload.put(String.valueOf(key), value));
        posts.add(new Post(url, payload));
        return true;
    }

    @Override
    public void close() {
        closed = true;
    }
}
