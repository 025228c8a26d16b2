package meilikeys.adapter.out.http;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import meilikeys.core.exception.KeysTransportException;

/**
 * JSON codec for the {@code /keys} resource.
 *
 * <p>Timestamps are written as RFC 3339 strings. Unknown properties are ignored for forward
 * compatibility; unknown {@link meilikeys.core.model.Action} tokens are not.
 */
public final class KeysJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private KeysJson() {}

    /**
     * A copy of the wire mapper. Reconfiguring it leaves the client's own encoding untouched.
     */
    public static ObjectMapper mapper() {
        return OBJECT_MAPPER.copy();
    }

    static <T> T convert(Object value, TypeReference<T> type) {
        return OBJECT_MAPPER.convertValue(value, type);
    }

    static <T> T read(byte[] body, Class<T> type) throws IOException {
        return OBJECT_MAPPER.readValue(body, type);
    }

    /**
     * Encode a request body.
     *
     * @throws KeysTransportException if the value cannot be encoded
     */
    public static byte[] encode(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new KeysTransportException("Failed to encode request body: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode a response body.
     *
     * @throws KeysTransportException if the body is empty or does not match {@code type}
     */
    public static <T> T decode(byte[] body, Class<T> type) {
        if (body == null || body.length == 0) {
            throw new KeysTransportException("Empty response body, expected " + type.getSimpleName());
        }
        try {
            return OBJECT_MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new KeysTransportException(
                    "Failed to decode " + type.getSimpleName() + " from response body: " + e.getMessage(), e);
        }
    }
}
