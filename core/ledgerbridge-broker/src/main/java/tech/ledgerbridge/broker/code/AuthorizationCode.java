package tech.ledgerbridge.broker.code;

import java.time.Instant;

/**
 * Authorization code handed to the outer client after the third-party leg.
 *
 * Authorization codes are:
 * - Short-lived (default: 10 minutes)
 * - Single-use (marked as used on first exchange)
 * - Bound to the broker session and the outer client's state
 */
public class AuthorizationCode {

    /**
     * The code value (64 hex characters).
     */
    public String code;

    /**
     * Session whose tenant credentials the code grants access to.
     */
    public String sessionId;

    /**
     * Outer client's state; locates the PKCE challenge at exchange time.
     */
    public String outerState;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean used = false;

    public Instant usedAt;

    public boolean isExpired() {
        return Instant.now().isAfter(expiresAt);
    }

    public boolean isValid() {
        return !used && !isExpired();
    }
}
