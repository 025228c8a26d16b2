package meilikeys.adapter.out.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import meilikeys.core.exception.KeysTransportException;
import meilikeys.core.model.KeyBuilder;
import meilikeys.core.model.KeysResults;

@DisplayName("KeysJson")
class KeysJsonTest {

    @Test
    @DisplayName("should hand out a mapper that does not affect the wire encoding")
    void shouldIsolateExposedMapper() throws Exception {
        var exposed = KeysJson.mapper();
        exposed.enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        var builder = new KeyBuilder().withExpiresAt(OffsetDateTime.of(2042, 4, 2, 0, 42, 42, 0, ZoneOffset.UTC));

        var encoded = KeysJson.mapper().readTree(KeysJson.encode(builder));

        assertNotSame(exposed, KeysJson.mapper());
        assertEquals("2042-04-02T00:42:42Z", encoded.get("expiresAt").asText());
    }

    @Test
    @DisplayName("should reject an empty body")
    void shouldRejectEmptyBody() {
        assertThrows(KeysTransportException.class, () -> KeysJson.decode(new byte[0], KeysResults.class));
    }

    @Test
    @DisplayName("should reject a body of the wrong shape")
    void shouldRejectWrongShape() {
        var body = "[1, 2, 3]".getBytes(StandardCharsets.UTF_8);

        assertThrows(KeysTransportException.class, () -> KeysJson.decode(body, KeysResults.class));
    }
}
