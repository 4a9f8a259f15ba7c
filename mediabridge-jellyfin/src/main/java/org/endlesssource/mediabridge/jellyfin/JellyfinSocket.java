package org.endlesssource.mediabridge.jellyfin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Persistent command channel to the server. Keeps the connection alive at the
 * interval the server asks for and reconnects after failures until closed.
 */
class JellyfinSocket extends WebSocketListener implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JellyfinSocket.class);
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl url;
    private final RemoteCommandListener listener;
    private final Duration reconnectDelay;
    private final ScheduledExecutorService scheduler;

    private WebSocket webSocket;
    private ScheduledFuture<?> keepAlive;
    private volatile boolean closed;

    JellyfinSocket(OkHttpClient httpClient, ObjectMapper mapper, HttpUrl url,
                   RemoteCommandListener listener, Duration reconnectDelay) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.url = url;
        this.listener = listener;
        this.reconnectDelay = reconnectDelay;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mediabridge-socket");
            thread.setDaemon(true);
            return thread;
        });
    }

    synchronized void open() {
        if (closed) {
            return;
        }
        logger.debug("Opening socket to {}", url.host());
        webSocket = httpClient.newWebSocket(new Request.Builder().url(url).build(), this);
    }

    @Override
    public void onOpen(WebSocket socket, Response response) {
        logger.info("Connected to server socket on {}", url.host());
    }

    @Override
    public void onMessage(WebSocket socket, String text) {
        JsonNode message;
        try {
            message = mapper.readTree(text);
        } catch (IOException e) {
            logger.warn("Ignoring unparsable socket frame: {}", e.getMessage());
            return;
        }

        OptionalInt keepAliveSeconds = InboundMessages.keepAliveSeconds(message);
        if (keepAliveSeconds.isPresent()) {
            scheduleKeepAlive(socket, keepAliveSeconds.getAsInt());
            return;
        }
        InboundMessages.route(message, listener);
    }

    @Override
    public void onClosing(WebSocket socket, int code, String reason) {
        // answer the peer's close frame so onClosed follows
        socket.close(NORMAL_CLOSURE, null);
    }

    @Override
    public void onClosed(WebSocket socket, int code, String reason) {
        logger.info("Server socket closed ({}): {}", code, reason);
        scheduleReconnect();
    }

    @Override
    public void onFailure(WebSocket socket, Throwable t, Response response) {
        logger.warn("Server socket failed: {}", t.getMessage());
        scheduleReconnect();
    }

    private synchronized void scheduleKeepAlive(WebSocket socket, int seconds) {
        cancelKeepAlive();
        if (closed) {
            return;
        }
        // send at half the server's timeout
        long periodMs = Math.max(1000L, seconds * 1000L / 2);
        keepAlive = scheduler.scheduleWithFixedDelay(() -> {
            if (!socket.send(InboundMessages.keepAliveFrame())) {
                logger.debug("Keep-alive not queued, socket is closing");
            }
        }, 0L, periodMs, TimeUnit.MILLISECONDS);
        logger.debug("Sending keep-alive every {} ms", periodMs);
    }

    private synchronized void scheduleReconnect() {
        cancelKeepAlive();
        if (closed) {
            return;
        }
        logger.info("Reconnecting in {}", reconnectDelay);
        scheduler.schedule(this::open, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelKeepAlive() {
        if (keepAlive != null) {
            keepAlive.cancel(false);
            keepAlive = null;
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        cancelKeepAlive();
        scheduler.shutdownNow();
        if (webSocket != null) {
            webSocket.close(NORMAL_CLOSURE, "client shutting down");
            webSocket = null;
        }
    }
}
