package meilikeys.adapter.out.http;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.spi.ConfigSource;

import meilikeys.core.config.ClientConfig;

/**
 * Entry points for obtaining a {@link KeysHttpClient}.
 *
 * <pre>{@code
 * try (var client = KeysClients.create("http://localhost:7700", "masterKey")) {
 *     var page = new KeysQuery(client).withLimit(5).execute().await().indefinitely();
 * }
 * }</pre>
 */
public final class KeysClients {

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private KeysClients() {}

    /**
     * Create a client for {@code host} with default timeouts.
     *
     * @param host   base URL of the server
     * @param apiKey key used to authenticate requests, or null
     */
    public static KeysHttpClient create(String host, String apiKey) {
        return KeysHttpClient.create(
                new StaticClientConfig(host, Optional.ofNullable(apiKey), DEFAULT_REQUEST_TIMEOUT, DEFAULT_CONNECT_TIMEOUT));
    }

    /**
     * Create a client from system properties, environment variables and
     * {@code META-INF/microprofile-config.properties}.
     *
     * @see ClientConfig
     */
    public static KeysHttpClient fromEnvironment() {
        return KeysHttpClient.create(loadConfig());
    }

    /**
     * Load {@link ClientConfig} from the default sources plus any additional ones.
     *
     * @param additionalSources extra sources, ranked by their ordinal
     * @return the mapped configuration
     */
    public static ClientConfig loadConfig(ConfigSource... additionalSources) {
        final var config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDiscoveredSources()
                .withSources(additionalSources)
                .withMapping(ClientConfig.class)
                .build();
        return config.getConfigMapping(ClientConfig.class);
    }

    private record StaticClientConfig(
            String host, Optional<String> apiKey, Duration requestTimeout, Duration connectTimeout)
            implements ClientConfig {}
}
