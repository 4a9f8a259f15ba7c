package org.endlesssource.mediabridge.jellyfin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.logging.HttpLoggingInterceptor;
import org.endlesssource.mediabridge.remote.GeneralCommand;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.endlesssource.mediabridge.remote.RemoteSessionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RemoteSessionClient} for Jellyfin servers, over OkHttp.
 * Calls are best effort: failures are logged and reported through the return value.
 */
public class JellyfinSessionClient implements RemoteSessionClient {
    private static final Logger logger = LoggerFactory.getLogger(JellyfinSessionClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(10);

    private final JellyfinClientInfo clientInfo;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Duration reconnectDelay;
    private volatile String token;
    private JellyfinSocket socket;

    public JellyfinSessionClient(JellyfinClientInfo clientInfo) {
        this(clientInfo, DEFAULT_TIMEOUT, DEFAULT_RECONNECT_DELAY);
    }

    public JellyfinSessionClient(JellyfinClientInfo clientInfo, Duration timeout, Duration reconnectDelay) {
        this.clientInfo = Objects.requireNonNull(clientInfo, "clientInfo must not be null");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay must not be null");

        HttpLoggingInterceptor logging = new HttpLoggingInterceptor(message -> logger.trace("{}", message));
        logging.setLevel(HttpLoggingInterceptor.Level.BASIC);
        this.httpClient = new OkHttpClient.Builder()
                .addInterceptor(new AuthorizationInterceptor())
                .addInterceptor(logging)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .followRedirects(true)
                .build();
    }

    private class AuthorizationInterceptor implements Interceptor {
        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request().newBuilder()
                    .header("Authorization", clientInfo.authorizationHeader(token))
                    .header("Accept", "application/json")
                    .build();
            return chain.proceed(request);
        }
    }

    @Override
    public String checkRedirect(String hostname) {
        try (Response response = httpClient.newCall(new Request.Builder().url(hostname).get().build()).execute()) {
            String resolved = ServerUrls.baseUrl(response.request().url());
            logger.debug("Redirect check {} -> {}", hostname, resolved);
            return resolved;
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Redirect check against {} failed, keeping configured address: {}", hostname, e.getMessage());
            return hostname;
        }
    }

    @Override
    public synchronized void connect(String hostname, String token, RemoteCommandListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        registerCapabilities(hostname);

        if (socket != null) {
            socket.close();
        }
        socket = new JellyfinSocket(httpClient, mapper,
                ServerUrls.socketUrl(hostname, token, clientInfo.deviceId()), listener, reconnectDelay);
        socket.open();
    }

    /**
     * Tell the server what this device can play and which remote commands it accepts.
     */
    boolean registerCapabilities(String hostname) {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("PlayableMediaTypes", List.of("Audio"));
        capabilities.put("SupportsMediaControl", true);
        capabilities.put("SupportedCommands", GeneralCommand.SUPPORTED);
        return post(hostname + "/Sessions/Capabilities/Full", capabilities);
    }

    @Override
    public Optional<JsonNode> get(String url) {
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid URL {}: {}", url, e.getMessage());
            return Optional.empty();
        }
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                logger.warn("GET {} failed with HTTP {}", url, response.code());
                return Optional.empty();
            }
            ResponseBody body = response.body();
            if (body == null) {
                return Optional.empty();
            }
            return Optional.of(mapper.readTree(body.string()));
        } catch (IOException e) {
            logger.warn("GET {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean post(String url) {
        return execute(url, RequestBody.create(new byte[0], JSON));
    }

    @Override
    public boolean post(String url, Object body) {
        try {
            return execute(url, RequestBody.create(mapper.writeValueAsString(body), JSON));
        } catch (JsonProcessingException e) {
            logger.warn("Unable to serialize body for {}: {}", url, e.getMessage());
            return false;
        }
    }

    private boolean execute(String url, RequestBody body) {
        Request request;
        try {
            request = new Request.Builder().url(url).post(body).build();
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid URL {}: {}", url, e.getMessage());
            return false;
        }
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                logger.warn("POST {} failed with HTTP {}", url, response.code());
                return false;
            }
            return true;
        } catch (IOException e) {
            logger.warn("POST {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void close() {
        if (socket != null) {
            socket.close();
            socket = null;
        }
    }
}
