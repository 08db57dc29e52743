package tech.ledgerbridge.broker.token.mapper;

import tech.ledgerbridge.broker.token.BrokerToken;
import tech.ledgerbridge.broker.token.entity.BrokerTokenEntity;

/**
 * Mapper for converting between BrokerToken domain model and JPA entity.
 */
public final class BrokerTokenMapper {

    private BrokerTokenMapper() {
    }

    public static BrokerToken toDomain(BrokerTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        BrokerToken domain = new BrokerToken();
        domain.token = entity.token;
        domain.sessionId = entity.sessionId;
        domain.issuedAt = entity.issuedAt;
        domain.expiresAt = entity.expiresAt;
        domain.refreshToken = entity.refreshToken;
        domain.refreshTokenExpiresAt = entity.refreshTokenExpiresAt;
        return domain;
    }

    public static BrokerTokenEntity toEntity(BrokerToken domain) {
        if (domain == null) {
            return null;
        }

        BrokerTokenEntity entity = new BrokerTokenEntity();
        entity.token = domain.token;
        entity.sessionId = domain.sessionId;
        entity.issuedAt = domain.issuedAt;
        entity.expiresAt = domain.expiresAt;
        entity.refreshToken = domain.refreshToken;
        entity.refreshTokenExpiresAt = domain.refreshTokenExpiresAt;
        return entity;
    }
}
