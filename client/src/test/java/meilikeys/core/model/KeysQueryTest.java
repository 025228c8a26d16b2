package meilikeys.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import meilikeys.adapter.out.http.KeysJson;
import meilikeys.core.port.out.KeysClient;

@DisplayName("KeysQuery")
@ExtendWith(MockitoExtension.class)
class KeysQueryTest {

    @Mock
    private KeysClient client;

    private KeysQuery query;

    @BeforeEach
    void setUp() {
        query = new KeysQuery(client);
    }

    @Test
    @DisplayName("should require a client")
    void shouldRequireClient() {
        assertThrows(IllegalArgumentException.class, () -> new KeysQuery(null));
    }

    @Nested
    @DisplayName("Parameters")
    class ParameterTests {

        @Test
        @DisplayName("should leave offset and limit unset by default")
        void shouldLeaveParametersUnset() {
            assertEquals(Optional.empty(), query.offset());
            assertEquals(Optional.empty(), query.limit());
        }

        @Test
        @DisplayName("should overwrite previous values")
        void shouldOverwriteValues() {
            query.withOffset(10).withLimit(50).withOffset(1).withLimit(2);

            assertEquals(Optional.of(1), query.offset());
            assertEquals(Optional.of(2), query.limit());
        }

        @Test
        @DisplayName("should not cap the limit locally")
        void shouldNotCapLimit() {
            query.withLimit(100_000);

            assertEquals(Optional.of(100_000), query.limit());
        }

        @Test
        @DisplayName("should reject negative values")
        void shouldRejectNegativeValues() {
            assertThrows(IllegalArgumentException.class, () -> query.withOffset(-1));
            assertThrows(IllegalArgumentException.class, () -> query.withLimit(-5));
        }
    }

    @Nested
    @DisplayName("Serialization")
    class SerializationTests {

        @Test
        @DisplayName("should write nothing when no parameter is set")
        void shouldWriteNothingWhenUnset() {
            var json = KeysJson.mapper().valueToTree(query);

            assertFalse(json.has("offset"));
            assertFalse(json.has("limit"));
            assertFalse(json.has("client"));
        }

        @Test
        @DisplayName("should write only the parameters that are set")
        void shouldWriteOnlySetParameters() {
            var json = KeysJson.mapper().valueToTree(query.withLimit(2));

            assertTrue(json.has("limit"));
            assertEquals(2, json.get("limit").asInt());
            assertFalse(json.has("offset"));
        }
    }

    @Nested
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("should list keys through the bound client")
        void shouldListThroughClient() {
            var results = new KeysResults(List.of(), 2, 1);
            query.withOffset(1).withLimit(2);
            when(client.executeGetKeys(query)).thenReturn(Uni.createFrom().item(results));

            var page = query.execute().await().indefinitely();

            verify(client).executeGetKeys(query);
            assertSame(results, page);
        }
    }
}
