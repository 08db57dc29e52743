package tech.ledgerbridge.broker.token.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.transaction.Transactional;
import tech.ledgerbridge.broker.shared.Instrumented;
import tech.ledgerbridge.broker.token.BrokerToken;
import tech.ledgerbridge.broker.token.BrokerTokenRepository;
import tech.ledgerbridge.broker.token.entity.BrokerTokenEntity;
import tech.ledgerbridge.broker.token.mapper.BrokerTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of BrokerTokenRepository.
 */
@ApplicationScoped
@Typed(PanacheBrokerTokenRepository.class)
@Instrumented(collection = "broker_tokens")
public class PanacheBrokerTokenRepository
    implements BrokerTokenRepository, PanacheRepositoryBase<BrokerTokenEntity, String> {

    @Override
    public Optional<BrokerToken> findByToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return findByIdOptional(token).map(BrokerTokenMapper::toDomain);
    }

    @Override
    public Optional<BrokerToken> findByRefreshToken(String refreshToken) {
        if (refreshToken == null) {
            return Optional.empty();
        }
        return find("refreshToken", refreshToken)
            .firstResultOptional()
            .map(BrokerTokenMapper::toDomain);
    }

    @Override
    @Transactional
    public void persist(BrokerToken token) {
        persist(BrokerTokenMapper.toEntity(token));
    }

    @Override
    @Transactional
    public boolean deleteByToken(String token) {
        return token != null && deleteById(token);
    }

    @Override
    @Transactional
    public int deleteExpired(Instant now) {
        return (int) delete(
            "expiresAt < ?1 and (refreshTokenExpiresAt is null or refreshTokenExpiresAt < ?1)", now);
    }
}
