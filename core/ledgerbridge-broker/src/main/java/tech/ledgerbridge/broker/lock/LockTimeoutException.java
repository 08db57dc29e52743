package tech.ledgerbridge.broker.lock;

import java.time.Duration;

/**
 * A tenant lock was not obtained within its bounded wait.
 */
public class LockTimeoutException extends RuntimeException {

    private final String tenantId;

    public LockTimeoutException(String tenantId, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for tenant lock: " + tenantId);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
