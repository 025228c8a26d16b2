package meilikeys.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Connection settings for the key management client.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code meilisearch.client.host} - Base URL of the server (required)</li>
 *   <li>{@code meilisearch.client.api-key} - Key sent as bearer token (optional)</li>
 *   <li>{@code meilisearch.client.request-timeout} - Per-request timeout (default: 30 seconds)</li>
 *   <li>{@code meilisearch.client.connect-timeout} - TCP connect timeout (default: 5 seconds)</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 * meilisearch.client.host=http://localhost:7700
 * meilisearch.client.api-key=masterKey
 * meilisearch.client.request-timeout=PT10S
 * </pre>
 *
 * Environment variables follow the usual mapping, e.g. {@code MEILISEARCH_CLIENT_HOST}.
 */
@ConfigMapping(prefix = "meilisearch.client")
public interface ClientConfig {

    /**
     * Base URL of the server, e.g. {@code http://localhost:7700}.
     */
    String host();

    /**
     * Key used to authenticate requests. Key management requires the master key or a key
     * granting {@code *}.
     *
     * @return the API key, or empty to send unauthenticated requests
     */
    Optional<String> apiKey();

    /**
     * Maximum time to wait for a response.
     *
     * @return Request timeout duration (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration requestTimeout();

    /**
     * Maximum time to establish a TCP connection.
     *
     * @return Connect timeout duration (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration connectTimeout();
}
