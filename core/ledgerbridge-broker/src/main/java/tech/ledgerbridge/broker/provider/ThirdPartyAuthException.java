package tech.ledgerbridge.broker.provider;

/**
 * The third party rejected a code exchange or refresh.
 */
public class ThirdPartyAuthException extends Exception {

    private final String error;

    public ThirdPartyAuthException(String error, String message) {
        super(message);
        this.error = error;
    }

    public ThirdPartyAuthException(String error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    /**
     * OAuth error code reported by the third party, when it sent one.
     */
    public String getError() {
        return error;
    }
}
