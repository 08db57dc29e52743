package tech.ledgerbridge.broker.session.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.transaction.Transactional;
import tech.ledgerbridge.broker.session.CompanySession;
import tech.ledgerbridge.broker.session.CompanySessionRepository;
import tech.ledgerbridge.broker.session.entity.CompanySessionEntity;
import tech.ledgerbridge.broker.session.mapper.CompanySessionMapper;
import tech.ledgerbridge.broker.shared.Instrumented;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of CompanySessionRepository.
 */
@ApplicationScoped
@Typed(PanacheCompanySessionRepository.class)
@Instrumented(collection = "company_sessions")
public class PanacheCompanySessionRepository
    implements CompanySessionRepository, PanacheRepositoryBase<CompanySessionEntity, String> {

    @Override
    public Optional<CompanySession> findBySessionId(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return findByIdOptional(sessionId).map(CompanySessionMapper::toDomain);
    }

    @Override
    public List<CompanySession> findByTenantId(String tenantId) {
        return find("tenantId", tenantId).stream()
            .map(CompanySessionMapper::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public void persist(CompanySession session) {
        CompanySessionEntity existing = findById(session.sessionId);
        if (existing != null) {
            CompanySessionMapper.updateEntity(existing, session);
        } else {
            persist(CompanySessionMapper.toEntity(session));
        }
    }

    @Override
    @Transactional
    public int updateTokensForTenant(String tenantId, String accessToken, String refreshToken, Instant tokenExpiresAt) {
        return update("accessToken = ?1, refreshToken = ?2, tokenExpiresAt = ?3 where tenantId = ?4",
            accessToken, refreshToken, tokenExpiresAt, tenantId);
    }

    @Override
    @Transactional
    public void touch(String sessionId, Instant lastUsedAt) {
        update("lastUsedAt = ?1 where sessionId = ?2", lastUsedAt, sessionId);
    }

    @Override
    @Transactional
    public int deleteByTenantId(String tenantId) {
        return (int) delete("tenantId", tenantId);
    }
}
