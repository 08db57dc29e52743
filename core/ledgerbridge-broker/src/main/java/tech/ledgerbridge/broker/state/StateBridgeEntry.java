package tech.ledgerbridge.broker.state;

import java.time.Instant;

/**
 * Links a third-party state token to the outer flow that started it.
 */
public class StateBridgeEntry {

    public String innerState;

    public String outerState;

    public String sessionId;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean isExpired() {
        return Instant.now().isAfter(expiresAt);
    }
}
