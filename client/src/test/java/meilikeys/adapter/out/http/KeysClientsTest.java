package meilikeys.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.smallrye.config.ConfigValidationException;
import io.smallrye.config.PropertiesConfigSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("KeysClients")
class KeysClientsTest {

    private static PropertiesConfigSource source(Map<String, String> properties) {
        return new PropertiesConfigSource(properties, "test", 500);
    }

    @Nested
    @DisplayName("loadConfig")
    class LoadConfigTests {

        @Test
        @DisplayName("should apply default timeouts")
        void shouldApplyDefaults() {
            var config = KeysClients.loadConfig(source(Map.of("meilisearch.client.host", "http://localhost:7700")));

            assertEquals("http://localhost:7700", config.host());
            assertEquals(Duration.ofSeconds(30), config.requestTimeout());
            assertEquals(Duration.ofSeconds(5), config.connectTimeout());
        }

        @Test
        @DisplayName("should read overrides")
        void shouldReadOverrides() {
            var config = KeysClients.loadConfig(source(Map.of(
                    "meilisearch.client.host", "https://search.example.com",
                    "meilisearch.client.api-key", "masterKey",
                    "meilisearch.client.request-timeout", "PT2S",
                    "meilisearch.client.connect-timeout", "PT0.5S")));

            assertEquals("https://search.example.com", config.host());
            assertEquals(Optional.of("masterKey"), config.apiKey());
            assertEquals(Duration.ofSeconds(2), config.requestTimeout());
            assertEquals(Duration.ofMillis(500), config.connectTimeout());
        }

        @Test
        @DisplayName("should fail without a host")
        void shouldFailWithoutHost() {
            var noHost = source(Map.of("meilisearch.client.api-key", "masterKey"));

            assertThrows(ConfigValidationException.class, () -> KeysClients.loadConfig(noHost));
        }
    }

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("should build a working client that owns its event loop")
        void shouldBuildWorkingClient() {
            var server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
            server.start();
            try {
                server.stubFor(get(urlEqualTo("/keys"))
                        .willReturn(aResponse()
                                .withStatus(200)
                                .withBody("{\"results\": [], \"offset\": 0, \"limit\": 20}")));

                try (var client = KeysClients.create(server.baseUrl(), null)) {
                    var page = client.getKeys().await().indefinitely();

                    assertTrue(page.results().isEmpty());
                }

                server.verify(getRequestedFor(urlEqualTo("/keys")).withoutHeader("Authorization"));
            } finally {
                server.stop();
            }
        }

        @Test
        @DisplayName("should reject an invalid host")
        void shouldRejectInvalidHost() {
            assertThrows(IllegalArgumentException.class, () -> KeysClients.create("localhost:7700", null));
        }
    }
}
