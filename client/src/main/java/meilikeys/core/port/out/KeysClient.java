package meilikeys.core.port.out;

import io.smallrye.mutiny.Uni;

import meilikeys.core.model.Key;
import meilikeys.core.model.KeyBuilder;
import meilikeys.core.model.KeysQuery;
import meilikeys.core.model.KeysResults;

/**
 * Port for the remote {@code /keys} resource of a Meilisearch server.
 *
 * <p>Every operation is a single request/response exchange. Failures surface through the
 * returned {@link Uni} as a {@link meilikeys.core.exception.KeysClientException}: either a
 * {@link meilikeys.core.exception.KeysApiException} when the server rejected the request, or a
 * {@link meilikeys.core.exception.KeysTransportException} when the call or the decoding of its
 * response failed. Nothing is retried.
 */
public interface KeysClient {

    /**
     * List keys using the server's default pagination (offset 0, limit 20).
     *
     * @return Uni with the first page of keys
     */
    Uni<KeysResults> getKeys();

    /**
     * Execute a paginated listing request.
     *
     * <p>Offset and limit are only sent when set on the query.
     *
     * @param query the pagination parameters
     * @return Uni with the requested page of keys
     */
    Uni<KeysResults> executeGetKeys(KeysQuery query);

    /**
     * Fetch a single key.
     *
     * @param keyOrUid the key value or its uid
     * @return Uni with the key
     */
    Uni<Key> getKey(String keyOrUid);

    /**
     * Fetch the current server state of a key.
     *
     * @param key a previously obtained key
     * @return Uni with the key as the server currently knows it
     */
    default Uni<Key> getKey(Key key) {
        return getKey(key.key());
    }

    /**
     * Create a new key.
     *
     * @param builder the creation request
     * @return Uni with the created key, carrying its server-assigned value and timestamps
     */
    Uni<Key> createKey(KeyBuilder builder);

    /**
     * Submit the writable state of a key as a partial update.
     *
     * @param key the key to update, identified by {@link Key#key()}
     * @return Uni with the key as stored after the update
     */
    Uni<Key> updateKey(Key key);

    /**
     * Delete a key.
     *
     * @param keyOrUid the key value or its uid
     * @return Uni completing once the server accepted the deletion
     */
    Uni<Void> deleteKey(String keyOrUid);

    /**
     * Delete a key. The local instance is left untouched and becomes stale.
     *
     * @param key the key to delete
     * @return Uni completing once the server accepted the deletion
     */
    default Uni<Void> deleteKey(Key key) {
        return deleteKey(key.key());
    }
}
