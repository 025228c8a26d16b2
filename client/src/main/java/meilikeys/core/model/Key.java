package meilikeys.core.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import io.smallrye.mutiny.Uni;

import meilikeys.core.port.out.KeysClient;
import meilikeys.core.util.SecureHash;

/**
 * An API key as returned by the server.
 *
 * <p>Keys are obtained from {@link KeysClient#getKey(String)}, from a listing, or by creating
 * one with {@link KeyBuilder}. Only the description and the name can be changed locally; the
 * change reaches the server through {@link #update(KeysClient)}.
 *
 * <p>Reading and writing use different shapes. A decoded key always carries {@code key},
 * {@code createdAt} and {@code updatedAt}; an encoded key never does (see {@link Payload}).
 *
 * <p>Two instances are equal when they hold the same {@code key} value.
 */
public final class Key {

    private final List<Action> actions;
    private final OffsetDateTime createdAt;
    private String description;
    private String name;
    private final OffsetDateTime expiresAt;
    private final List<String> indexes;
    private final String key;
    private final String uid;
    private final OffsetDateTime updatedAt;

    /**
     * @param actions     granted actions (null = none)
     * @param createdAt   creation time assigned by the server
     * @param description optional description
     * @param name        optional display name
     * @param expiresAt   expiry time (null = never expires)
     * @param indexes     index names or {@code "*"} the key is scoped to (null = none)
     * @param key         the secret key value
     * @param uid         optional server-assigned uid
     * @param updatedAt   last update time assigned by the server
     */
    @JsonCreator
    public Key(
            @JsonProperty("actions") List<Action> actions,
            @JsonProperty("createdAt") OffsetDateTime createdAt,
            @JsonProperty("description") String description,
            @JsonProperty("name") String name,
            @JsonProperty("expiresAt") OffsetDateTime expiresAt,
            @JsonProperty("indexes") List<String> indexes,
            @JsonProperty("key") String key,
            @JsonProperty("uid") String uid,
            @JsonProperty("updatedAt") OffsetDateTime updatedAt) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key value cannot be null or blank");
        }
        this.actions = actions != null ? List.copyOf(actions) : List.of();
        this.createdAt = createdAt;
        this.description = description;
        this.name = name;
        this.expiresAt = expiresAt;
        this.indexes = indexes != null ? List.copyOf(indexes) : List.of();
        this.key = key;
        this.uid = uid;
        this.updatedAt = updatedAt;
    }

    public List<Action> actions() {
        return actions;
    }

    public OffsetDateTime createdAt() {
        return createdAt;
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
        return indexes;
    }

    /**
     * The secret key value. Identifies this key in every client operation.
     */
    public String key() {
        return key;
    }

    public String uid() {
        return uid;
    }

    public OffsetDateTime updatedAt() {
        return updatedAt;
    }

    /**
     * Set the description sent with the next {@link #update(KeysClient)}.
     *
     * @param description the new description
     * @return this key
     */
    public Key withDescription(String description) {
        this.description = description;
        return this;
    }

    /**
     * Set the name sent with the next {@link #update(KeysClient)}.
     *
     * @param name the new name
     * @return this key
     */
    public Key withName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Submit the writable state of this key. This instance is not modified; the returned key
     * reflects the server state, including a refreshed {@code updatedAt}.
     *
     * @param client the client to send the request with
     * @return Uni with the updated key
     */
    public Uni<Key> update(KeysClient client) {
        return client.updateKey(this);
    }

    /**
     * The shape written on the wire for this key.
     */
    @JsonValue
    public Payload payload() {
        return new Payload(actions, description, name, expiresAt, indexes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Key other && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return "Key[uid=" + uid + ", name=" + name + ", key=" + SecureHash.fingerprint(key) + ", actions=" + actions
                + ", indexes=" + indexes + ", expiresAt=" + expiresAt + "]";
    }

    /**
     * Write view of a {@link Key}.
     *
     * <p>Server-managed fields are absent. Empty {@code actions} and {@code indexes} are
     * omitted, as is a missing {@code expiresAt}.
     *
     * @param actions     granted actions
     * @param description description, written as null when unset
     * @param name        display name, written as null when unset
     * @param expiresAt   expiry time, omitted when null
     * @param indexes     index scope
     */
    public record Payload(
            @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Action> actions,
            String description,
            String name,
            @JsonInclude(JsonInclude.Include.NON_NULL) OffsetDateTime expiresAt,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> indexes) {}
}
