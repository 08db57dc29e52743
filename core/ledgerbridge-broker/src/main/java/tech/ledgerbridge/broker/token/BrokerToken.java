package tech.ledgerbridge.broker.token;

import java.time.Instant;

/**
 * Bearer credential issued by the broker to the outer client.
 *
 * <p>Its lifetime is independent of the tenant's third-party tokens; a valid
 * broker token may still lead to a session that needs reauthorization.
 */
public class BrokerToken {

    /**
     * Bearer value, {@code mcp_} followed by 64 hex characters.
     */
    public String token;

    public String sessionId;

    public Instant issuedAt = Instant.now();

    public Instant expiresAt;

    /**
     * Present only when broker token refresh is enabled.
     */
    public String refreshToken;

    public Instant refreshTokenExpiresAt;

    /**
     * A token is accepted up to and including {@code expiresAt}.
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isRefreshTokenExpired(Instant now) {
        return refreshToken == null
            || refreshTokenExpiresAt == null
            || now.isAfter(refreshTokenExpiresAt);
    }

    public BrokerToken copy() {
        BrokerToken copy = new BrokerToken();
        copy.token = token;
        copy.sessionId = sessionId;
        copy.issuedAt = issuedAt;
        copy.expiresAt = expiresAt;
        copy.refreshToken = refreshToken;
        copy.refreshTokenExpiresAt = refreshTokenExpiresAt;
        return copy;
    }
}
