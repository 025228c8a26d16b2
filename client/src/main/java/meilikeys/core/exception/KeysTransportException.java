package meilikeys.core.exception;

/**
 * Thrown when a request could not be completed or its response could not be decoded:
 * connection failures, timeouts, and malformed or unexpected response bodies.
 */
public class KeysTransportException extends KeysClientException {

    public KeysTransportException(String message) {
        super(message);
    }

    public KeysTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
