package meilikeys.core.model;

import java.util.List;

/**
 * A page of keys together with the pagination the server applied.
 *
 * @param results the keys in this page
 * @param limit   maximum number of keys the page could hold
 * @param offset  number of keys skipped before this page
 */
public record KeysResults(List<Key> results, int limit, int offset) {

    public KeysResults {
        results = results != null ? List.copyOf(results) : List.of();
    }
}
