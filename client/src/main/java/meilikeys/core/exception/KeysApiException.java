package meilikeys.core.exception;

import java.util.Optional;

/**
 * Thrown when the server answered with an error status.
 *
 * <p>Preserves the structured error the server returned, e.g.
 * <pre>{@code
 * {
 *   "message": "API key `abc` not found.",
 *   "code": "api_key_not_found",
 *   "type": "invalid_request",
 *   "link": "https://docs.meilisearch.com/errors#api_key_not_found"
 * }
 * }</pre>
 * The error fields are empty when the response body did not carry them.
 */
public class KeysApiException extends KeysClientException {

    private final int statusCode;
    private final String errorCode;
    private final String errorType;
    private final String errorLink;

    public KeysApiException(int statusCode, String message, String errorCode, String errorType, String errorLink) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.errorType = errorType;
        this.errorLink = errorLink;
    }

    /**
     * HTTP status of the response.
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * Machine-readable error code, e.g. {@code api_key_not_found}.
     */
    public Optional<String> errorCode() {
        return Optional.ofNullable(errorCode);
    }

    /**
     * Error category, e.g. {@code invalid_request} or {@code auth}.
     */
    public Optional<String> errorType() {
        return Optional.ofNullable(errorType);
    }

    /**
     * Documentation link for the error.
     */
    public Optional<String> errorLink() {
        return Optional.ofNullable(errorLink);
    }
}
