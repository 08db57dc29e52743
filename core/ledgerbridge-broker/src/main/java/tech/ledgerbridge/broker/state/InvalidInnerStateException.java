package tech.ledgerbridge.broker.state;

/**
 * The state returned by the third party cannot be decoded.
 */
public class InvalidInnerStateException extends RuntimeException {

    public InvalidInnerStateException(String message) {
        super(message);
    }

    public InvalidInnerStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
