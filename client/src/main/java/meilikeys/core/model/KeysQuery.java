package meilikeys.core.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import io.smallrye.mutiny.Uni;

import meilikeys.core.port.out.KeysClient;

/**
 * Paginated listing of keys, bound to the client that executes it.
 *
 * <p>Unset parameters are left out of the request so the server applies its defaults
 * (offset 0, limit 20).
 */
public class KeysQuery {

    private final KeysClient client;
    private Integer offset;
    private Integer limit;

    public KeysQuery(KeysClient client) {
        if (client == null) {
            throw new IllegalArgumentException("Client cannot be null");
        }
        this.client = client;
    }

    /**
     * Number of keys to skip. Setting it to {@code 1} skips the first key.
     */
    public KeysQuery withOffset(int offset) {
        this.offset = requireNonNegative("offset", offset);
        return this;
    }

    /**
     * Maximum number of keys returned. The server defaults to {@code 20}.
     */
    public KeysQuery withLimit(int limit) {
        this.limit = requireNonNegative("limit", limit);
        return this;
    }

    public Optional<Integer> offset() {
        return Optional.ofNullable(offset);
    }

    public Optional<Integer> limit() {
        return Optional.ofNullable(limit);
    }

    /**
     * Execute the query and fetch the requested page.
     */
    public Uni<KeysResults> execute() {
        return client.executeGetKeys(this);
    }

    /**
     * The request parameters as written on the wire.
     */
    @JsonValue
    public Parameters parameters() {
        return new Parameters(offset, limit);
    }

    private static int requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " cannot be negative, got " + value);
        }
        return value;
    }

    /**
     * Listing parameters; absent values are omitted.
     *
     * @param offset number of keys to skip
     * @param limit  maximum number of keys returned
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Parameters(Integer offset, Integer limit) {}
}
