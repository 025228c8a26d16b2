package meilikeys.adapter.out.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import meilikeys.core.config.ClientConfig;
import meilikeys.core.exception.KeysApiException;
import meilikeys.core.exception.KeysClientException;
import meilikeys.core.exception.KeysTransportException;
import meilikeys.core.model.Key;
import meilikeys.core.model.KeyBuilder;
import meilikeys.core.model.KeysQuery;
import meilikeys.core.model.KeysResults;
import meilikeys.core.port.out.KeysClient;
import meilikeys.core.util.SecureHash;

/**
 * {@link KeysClient} over HTTP using the Vert.x WebClient.
 *
 * <h2>Routes</h2>
 * <pre>
 * GET    /keys?offset=&amp;limit=   list keys
 * GET    /keys/{key_or_uid}     get one key
 * POST   /keys                  create a key
 * PATCH  /keys/{key}            update a key
 * DELETE /keys/{key_or_uid}     delete a key
 * </pre>
 *
 * <p>Requests carry {@code Authorization: Bearer <api key>} when an API key is configured.
 * Non-2xx responses fail with {@link KeysApiException}; connection errors, timeouts and
 * undecodable bodies fail with {@link KeysTransportException}. Secret key values never
 * appear in log output, only their {@link SecureHash#fingerprint(String) fingerprint}.
 */
public class KeysHttpClient implements KeysClient, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(KeysHttpClient.class);
    private static final String KEYS_PATH = "/keys";
    private static final String USER_AGENT = "meilikeys-client";
    private static final TypeReference<Map<String, Object>> QUERY_PARAMS_TYPE = new TypeReference<>() {};

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final WebClient webClient;
    private final String baseUrl;
    private final Optional<String> apiKey;
    private final long requestTimeoutMillis;

    /**
     * Create a client on a caller-managed Vert.x instance. {@link #close()} leaves it running.
     *
     * @param vertx  the Vert.x instance to run requests on
     * @param config connection settings
     */
    public KeysHttpClient(Vertx vertx, ClientConfig config) {
        this(vertx, config, false);
    }

    private KeysHttpClient(Vertx vertx, ClientConfig config, boolean ownsVertx) {
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.baseUrl = normalizeHost(config.host());
        this.apiKey = config.apiKey().filter(key -> !key.isBlank());
        this.requestTimeoutMillis = config.requestTimeout().toMillis();

        final var options = new WebClientOptions()
                .setUserAgent(USER_AGENT)
                .setConnectTimeout((int) Math.min(config.connectTimeout().toMillis(), Integer.MAX_VALUE));
        this.webClient = WebClient.create(vertx, options);
    }

    /**
     * Create a client with its own Vert.x instance, closed together with the client.
     *
     * @param config connection settings
     * @return a new client
     */
    public static KeysHttpClient create(ClientConfig config) {
        normalizeHost(config.host());
        return new KeysHttpClient(Vertx.vertx(), config, true);
    }

    @Override
    public Uni<KeysResults> getKeys() {
        return send(HttpMethod.GET, KEYS_PATH, KEYS_PATH, Map.of(), null)
                .map(response -> decode(response, KeysResults.class))
                .onFailure(KeysHttpClient::isUnmapped)
                .transform(error -> transportFailure(HttpMethod.GET, KEYS_PATH, error));
    }

    @Override
    public Uni<KeysResults> executeGetKeys(KeysQuery query) {
        final Map<String, Object> params = KeysJson.convert(query, QUERY_PARAMS_TYPE);
        return send(HttpMethod.GET, KEYS_PATH, KEYS_PATH, params, null)
                .map(response -> decode(response, KeysResults.class))
                .onFailure(KeysHttpClient::isUnmapped)
                .transform(error -> transportFailure(HttpMethod.GET, KEYS_PATH, error));
    }

    @Override
    public Uni<Key> getKey(String keyOrUid) {
        if (isBlank(keyOrUid)) {
            return Uni.createFrom().failure(blankIdentifier());
        }
        final var logPath = keyLogPath(keyOrUid);
        return send(HttpMethod.GET, keyPath(keyOrUid), logPath, Map.of(), null)
                .map(response -> decode(response, Key.class))
                .onFailure(KeysHttpClient::isUnmapped)
                .transform(error -> transportFailure(HttpMethod.GET, logPath, error));
    }

    @Override
    public Uni<Key> createKey(KeyBuilder builder) {
        return send(HttpMethod.POST, KEYS_PATH, KEYS_PATH, Map.of(), builder)
                .map(response -> decode(response, Key.class))
                .invoke(key -> LOG.debugf("Created key: uid=%s, key=%s", key.uid(), SecureHash.fingerprint(key.key())))
                .onFailure(KeysHttpClient::isUnmapped)
                .transform(error -> transportFailure(HttpMethod.POST, KEYS_PATH, error));
    }

    @Override
    public Uni<Key> updateKey(Key key) {
        final var logPath = keyLogPath(key.key());
        return send(HttpMethod.PATCH, keyPath(key.key()), logPath, Map.of(), key)
                .map(response -> decode(response, Key.class))
                .onFailure(KeysHttpClient::isUnmapped)
                .transform(error -> transportFailure(HttpMethod.PATCH, logPath, error));
    }

    @Override
    public Uni<Void> deleteKey(String keyOrUid) {
        if (isBlank(keyOrUid)) {
            return Uni.createFrom().failure(blankIdentifier());
        }
        final var logPath = keyLogPath(keyOrUid);
        return send(HttpMethod.DELETE, keyPath(keyOrUid), logPath, Map.of(), null)
                .map(this::ensureSuccess)
                .replaceWithVoid()
                .onFailure(KeysHttpClient::isUnmapped)
                .transform(error -> transportFailure(HttpMethod.DELETE, logPath, error));
    }

    @Override
    public void close() {
        webClient.close();
        if (ownsVertx) {
            vertx.closeAndAwait();
        }
    }

    private Uni<HttpResponse<Buffer>> send(
            HttpMethod method, String path, String logPath, Map<String, Object> queryParams, Object body) {
        final HttpRequest<Buffer> request = webClient
                .requestAbs(method, baseUrl + path)
                .timeout(requestTimeoutMillis)
                .putHeader("Accept", "application/json");
        apiKey.ifPresent(key -> request.putHeader("Authorization", "Bearer " + key));
        queryParams.forEach((name, value) -> request.addQueryParam(name, String.valueOf(value)));

        return Uni.createFrom()
                .deferred(() -> {
                    LOG.debugf("Sending %s %s %s", method, logPath, queryParams);
                    if (body == null) {
                        return request.send();
                    }
                    final var payload = KeysJson.encode(body);
                    return request.putHeader("Content-Type", "application/json")
                            .sendBuffer(Buffer.buffer(payload));
                })
                .invoke(response -> LOG.debugf("Received %d for %s %s", response.statusCode(), method, logPath));
    }

    private <T> T decode(HttpResponse<Buffer> response, Class<T> type) {
        ensureSuccess(response);
        final var body = response.body();
        return KeysJson.decode(body != null ? body.getBytes() : null, type);
    }

    private HttpResponse<Buffer> ensureSuccess(HttpResponse<Buffer> response) {
        final var status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response;
        }
        final var body = response.body() != null ? response.body().getBytes() : new byte[0];
        final var error = parseError(body);
        final var message = error.map(ApiError::message)
                .filter(m -> !m.isBlank())
                .orElseGet(() -> fallbackMessage(status, body));
        throw new KeysApiException(
                status,
                message,
                error.map(ApiError::code).orElse(null),
                error.map(ApiError::type).orElse(null),
                error.map(ApiError::link).orElse(null));
    }

    private Optional<ApiError> parseError(byte[] body) {
        if (body.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(KeysJson.read(body, ApiError.class));
        } catch (IOException e) {
            LOG.debugf("Error response is not a structured error: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private static String fallbackMessage(int status, byte[] body) {
        final var text = new String(body, StandardCharsets.UTF_8).strip();
        return text.isEmpty() ? "HTTP " + status : "HTTP " + status + ": " + text;
    }

    private static boolean isUnmapped(Throwable error) {
        return !(error instanceof KeysClientException);
    }

    // The cause message can carry the request URL, and with it a raw key value.
    private static KeysTransportException transportFailure(HttpMethod method, String logPath, Throwable error) {
        return new KeysTransportException(
                "%s %s failed: %s".formatted(method, logPath, error.getClass().getSimpleName()), error);
    }

    private static boolean isBlank(String keyOrUid) {
        return keyOrUid == null || keyOrUid.isBlank();
    }

    private static IllegalArgumentException blankIdentifier() {
        return new IllegalArgumentException("Key or uid cannot be null or blank");
    }

    private static String keyPath(String keyOrUid) {
        return KEYS_PATH + "/" + URLEncoder.encode(keyOrUid, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String keyLogPath(String keyOrUid) {
        return KEYS_PATH + "/" + SecureHash.fingerprint(keyOrUid);
    }

    private static String normalizeHost(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host cannot be null or blank");
        }
        final var uri = URI.create(host.strip());
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Host must be an http or https URL, got " + host);
        }
        var normalized = uri.toString();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
