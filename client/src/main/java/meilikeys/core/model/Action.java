package meilikeys.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Permission scopes an API key may grant.
 *
 * <p>Each action maps to a fixed wire token. The set is closed: decoding a
 * token that is not listed here fails instead of falling back to a default.
 */
public enum Action {
    /** Access to every route. */
    ALL("*"),

    /** Search routes (GET and POST) on authorized indexes. */
    SEARCH("search"),

    /** Add and update documents on authorized indexes. */
    DOCUMENTS_ADD("documents.add"),

    /** Get one or many documents on authorized indexes. */
    DOCUMENTS_GET("documents.get"),

    /** Delete one, many or all documents on authorized indexes. */
    DOCUMENTS_DELETE("documents.delete"),

    /** Create an index. */
    INDEXES_CREATE("indexes.create"),

    /** Get one index or list indexes. Non-authorized indexes are omitted from listings. */
    INDEXES_GET("indexes.get"),

    /** Update an index. */
    INDEXES_UPDATE("indexes.update"),

    /** Delete an index. */
    INDEXES_DELETE("indexes.delete"),

    /** Get one task or list tasks. Tasks of non-authorized indexes are omitted. */
    TASKS_GET("tasks.get"),

    /** Read settings and their sub-routes on authorized indexes. */
    SETTINGS_GET("settings.get"),

    /** Update and reset settings and their sub-routes on authorized indexes. */
    SETTINGS_UPDATE("settings.update"),

    /** Stats of one index or of all indexes. */
    STATS_GET("stats.get"),

    /** Create a dump. Not restricted by indexes. */
    DUMPS_CREATE("dumps.create"),

    /** Get dump status. Not restricted by indexes. */
    DUMPS_GET("dumps.get"),

    /** Get the server version. */
    VERSION("version");

    private static final Map<String, Action> BY_TOKEN =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Action::token, Function.identity()));

    private final String token;

    Action(String token) {
        this.token = token;
    }

    /**
     * The wire token for this action, e.g. {@code "documents.add"}.
     */
    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Resolves an action from its wire token.
     *
     * @param token the wire token
     * @return the matching action
     * @throws IllegalArgumentException if the token is null or unknown
     */
    @JsonCreator
    public static Action fromToken(String token) {
        final var action = token != null ? BY_TOKEN.get(token) : null;
        if (action == null) {
            throw new IllegalArgumentException("Unknown key action: " + token);
        }
        return action;
    }
}
