package tech.ledgerbridge.broker.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of company sessions with a secondary lookup by tenant.
 */
public interface CompanySessionRepository {

    // Read operations
    Optional<CompanySession> findBySessionId(String sessionId);
    List<CompanySession> findByTenantId(String tenantId);

    // Write operations
    void persist(CompanySession session);

    /**
     * Write new tokens to every session of a tenant.
     *
     * @return number of sessions updated
     */
    int updateTokensForTenant(String tenantId, String accessToken, String refreshToken, Instant tokenExpiresAt);

    void touch(String sessionId, Instant lastUsedAt);

    /**
     * @return number of sessions removed
     */
    int deleteByTenantId(String tenantId);
}
