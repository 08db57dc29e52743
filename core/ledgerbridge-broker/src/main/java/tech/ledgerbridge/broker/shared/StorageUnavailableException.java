package tech.ledgerbridge.broker.shared;

/**
 * A durable store stayed unreachable after all retry attempts.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String operation, int attempts, Throwable cause) {
        super("Storage operation '" + operation + "' failed after " + attempts + " attempt(s)", cause);
    }
}
