package tech.ledgerbridge.broker.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Third-party credentials for one tenant, held on behalf of one broker session.
 *
 * <p>Several sessions may reference the same tenant. Each keeps its own copy of the
 * tenant's current tokens; refresh rewrites every copy.
 */
public class CompanySession {

    public String sessionId;

    /**
     * Third-party company identifier (realmId).
     */
    public String tenantId;

    public String accessToken;

    public String refreshToken;

    public Instant tokenExpiresAt;

    public Instant createdAt = Instant.now();

    public Instant lastUsedAt;

    /**
     * Whether the access token expires sooner than {@code window} from now.
     */
    public boolean expiresWithin(Duration window) {
        return tokenExpiresAt == null || tokenExpiresAt.isBefore(Instant.now().plus(window));
    }

    /**
     * New session for {@code newSessionId} carrying this session's tenant tokens.
     */
    public CompanySession shareWith(String newSessionId) {
        CompanySession shared = new CompanySession();
        shared.sessionId = newSessionId;
        shared.tenantId = tenantId;
        shared.accessToken = accessToken;
        shared.refreshToken = refreshToken;
        shared.tokenExpiresAt = tokenExpiresAt;
        shared.createdAt = Instant.now();
        return shared;
    }

    public CompanySession copy() {
        CompanySession copy = shareWith(sessionId);
        copy.createdAt = createdAt;
        copy.lastUsedAt = lastUsedAt;
        return copy;
    }
}
