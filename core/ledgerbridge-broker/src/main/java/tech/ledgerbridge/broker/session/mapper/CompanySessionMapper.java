package tech.ledgerbridge.broker.session.mapper;

import tech.ledgerbridge.broker.session.CompanySession;
import tech.ledgerbridge.broker.session.entity.CompanySessionEntity;

/**
 * Mapper for converting between CompanySession domain model and JPA entity.
 */
public final class CompanySessionMapper {

    private CompanySessionMapper() {
    }

    public static CompanySession toDomain(CompanySessionEntity entity) {
        if (entity == null) {
            return null;
        }

        CompanySession domain = new CompanySession();
        domain.sessionId = entity.sessionId;
        domain.tenantId = entity.tenantId;
        domain.accessToken = entity.accessToken;
        domain.refreshToken = entity.refreshToken;
        domain.tokenExpiresAt = entity.tokenExpiresAt;
        domain.createdAt = entity.createdAt;
        domain.lastUsedAt = entity.lastUsedAt;
        return domain;
    }

    public static CompanySessionEntity toEntity(CompanySession domain) {
        if (domain == null) {
            return null;
        }

        CompanySessionEntity entity = new CompanySessionEntity();
        entity.sessionId = domain.sessionId;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt;
        return entity;
    }

    public static void updateEntity(CompanySessionEntity entity, CompanySession domain) {
        entity.tenantId = domain.tenantId;
        entity.accessToken = domain.accessToken;
        entity.refreshToken = domain.refreshToken;
        entity.tokenExpiresAt = domain.tokenExpiresAt;
        entity.lastUsedAt = domain.lastUsedAt;
    }
}
