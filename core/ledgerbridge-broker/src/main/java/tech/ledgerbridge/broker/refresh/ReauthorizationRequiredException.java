package tech.ledgerbridge.broker.refresh;

/**
 * The tenant's third-party credentials can no longer be used; the user must
 * reconnect through the authorization flow.
 */
public class ReauthorizationRequiredException extends RuntimeException {

    private final String tenantId;

    public ReauthorizationRequiredException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public ReauthorizationRequiredException(String tenantId, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
