package meilikeys.core.exception;

/**
 * Base class for failures of a key management call.
 *
 * @see KeysApiException
 * @see KeysTransportException
 */
public abstract class KeysClientException extends RuntimeException {

    protected KeysClientException(String message) {
        super(message);
    }

    protected KeysClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
