package tech.ledgerbridge.broker.session;

import jakarta.enterprise.inject.Typed;
import jakarta.inject.Singleton;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Process-local company sessions. Lost on restart; intended for development and tests.
 *
 * <p>Note: @Typed excludes CompanySessionRepository from bean types so only the
 * DurableStoreProducer can provide the interface.
 */
@Singleton
@Typed(InMemoryCompanySessionRepository.class)
public class InMemoryCompanySessionRepository implements CompanySessionRepository {

    private final ConcurrentMap<String, CompanySession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<CompanySession> findBySessionId(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId)).map(CompanySession::copy);
    }

    @Override
    public List<CompanySession> findByTenantId(String tenantId) {
        return sessions.values().stream()
            .filter(s -> s.tenantId.equals(tenantId))
            .map(CompanySession::copy)
            .collect(Collectors.toList());
    }

    @Override
    public void persist(CompanySession session) {
        sessions.put(session.sessionId, session.copy());
    }

    @Override
    public int updateTokensForTenant(String tenantId, String accessToken, String refreshToken, Instant tokenExpiresAt) {
        int updated = 0;
        for (String sessionId : sessions.keySet()) {
            CompanySession result = sessions.computeIfPresent(sessionId, (key, s) -> {
                if (!s.tenantId.equals(tenantId)) {
                    return s;
                }
                CompanySession next = s.copy();
                next.accessToken = accessToken;
                next.refreshToken = refreshToken;
                next.tokenExpiresAt = tokenExpiresAt;
                return next;
            });
            if (result != null && result.tenantId.equals(tenantId)) {
                updated++;
            }
        }
        return updated;
    }

    @Override
    public void touch(String sessionId, Instant lastUsedAt) {
        sessions.computeIfPresent(sessionId, (key, s) -> {
            CompanySession next = s.copy();
            next.lastUsedAt = lastUsedAt;
            return next;
        });
    }

    @Override
    public int deleteByTenantId(String tenantId) {
        int removed = 0;
        for (var entry : sessions.entrySet()) {
            if (entry.getValue().tenantId.equals(tenantId) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
