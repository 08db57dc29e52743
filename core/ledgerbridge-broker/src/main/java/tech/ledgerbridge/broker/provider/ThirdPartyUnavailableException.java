package tech.ledgerbridge.broker.provider;

/**
 * The third party could not be reached or answered with a server error.
 */
public class ThirdPartyUnavailableException extends ThirdPartyAuthException {

    public ThirdPartyUnavailableException(String message) {
        super("temporarily_unavailable", message);
    }

    public ThirdPartyUnavailableException(String message, Throwable cause) {
        super("temporarily_unavailable", message, cause);
    }
}
