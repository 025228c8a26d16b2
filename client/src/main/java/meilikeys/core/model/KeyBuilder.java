package meilikeys.core.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import io.smallrye.mutiny.Uni;

import meilikeys.core.port.out.KeysClient;

/**
 * Request to create a {@link Key}: the same shape without the fields the server assigns.
 *
 * <p>Actions accumulate: {@link #withActions(Iterable)} and {@link #withAction(Action)} append
 * and never de-duplicate. Indexes are a scope: {@link #withIndexes(Iterable)} replaces them while
 * {@link #withIndex(String)} appends one.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Key key = new KeyBuilder()
 *         .withName("search-only")
 *         .withAction(Action.SEARCH)
 *         .withIndex("movies")
 *         .withExpiresAt(OffsetDateTime.now(ZoneOffset.UTC).plusWeeks(2))
 *         .execute(client)
 *         .await()
 *         .indefinitely();
 * }</pre>
 */
public class KeyBuilder {

    private final List<Action> actions = new ArrayList<>();
    private String description;
    private String name;
    private OffsetDateTime expiresAt;
    private List<String> indexes = new ArrayList<>();

    public KeyBuilder withActions(Iterable<Action> actions) {
        for (var action : actions) {
            withAction(action);
        }
        return this;
    }

    public KeyBuilder withAction(Action action) {
        if (action == null) {
            throw new IllegalArgumentException("Action cannot be null");
        }
        actions.add(action);
        return this;
    }

    /**
     * Set when the key stops being valid, replacing any previous value.
     */
    public KeyBuilder withExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
        return this;
    }

    /**
     * Replace the indexes the key is scoped to.
     */
    public KeyBuilder withIndexes(Iterable<String> indexes) {
        final var replacement = new ArrayList<String>();
        for (var index : indexes) {
            replacement.add(requireIndex(index));
        }
        this.indexes = replacement;
        return this;
    }

    public KeyBuilder withIndex(String index) {
        indexes.add(requireIndex(index));
        return this;
    }

    public KeyBuilder withDescription(String description) {
        this.description = description;
        return this;
    }

    public KeyBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public List<Action> actions() {
        return Collections.unmodifiableList(actions);
    }

    public String description() {
        return description;
    }

    public String name() {
        return name;
    }

    public OffsetDateTime expiresAt() {
        return expiresAt;
    }

    public List<String> indexes() {
        return Collections.unmodifiableList(indexes);
    }

    /**
     * Create the key on the server.
     *
     * @param client the client to send the request with
     * @return Uni with the created key
     */
    public Uni<Key> execute(KeysClient client) {
        return client.createKey(this);
    }

    /**
     * The shape written on the wire for this request.
     */
    @JsonValue
    public Payload payload() {
        return new Payload(List.copyOf(actions), description, name, expiresAt, List.copyOf(indexes));
    }

    private static String requireIndex(String index) {
        if (index == null) {
            throw new IllegalArgumentException("Index cannot be null");
        }
        return index;
    }

    /**
     * Write view of a {@link KeyBuilder}.
     *
     * <p>{@code actions}, {@code indexes} and {@code expiresAt} are always written because key
     * creation requires them; a null {@code expiresAt} creates a key that never expires.
     * {@code description} and {@code name} are omitted when unset.
     *
     * @param actions     granted actions
     * @param description optional description
     * @param name        optional display name
     * @param expiresAt   expiry time, null for a key that never expires
     * @param indexes     index scope
     */
    public record Payload(
            List<Action> actions,
            @JsonInclude(JsonInclude.Include.NON_NULL) String description,
            @JsonInclude(JsonInclude.Include.NON_NULL) String name,
            OffsetDateTime expiresAt,
            List<String> indexes) {}
}
