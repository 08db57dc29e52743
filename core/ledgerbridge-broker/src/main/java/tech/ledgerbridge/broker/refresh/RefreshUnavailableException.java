package tech.ledgerbridge.broker.refresh;

/**
 * The tenant's tokens are due for refresh but the third party could not be reached.
 * The stored credentials are untouched; the caller may retry.
 */
public class RefreshUnavailableException extends RuntimeException {

    private final String tenantId;

    public RefreshUnavailableException(String tenantId, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
