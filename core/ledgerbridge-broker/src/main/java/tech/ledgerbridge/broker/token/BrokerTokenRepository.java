package tech.ledgerbridge.broker.token;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable store of broker-issued bearer tokens.
 */
public interface BrokerTokenRepository {

    // Read operations
    Optional<BrokerToken> findByToken(String token);
    Optional<BrokerToken> findByRefreshToken(String refreshToken);

    // Write operations
    void persist(BrokerToken token);

    /**
     * @return true if this call removed the token
     */
    boolean deleteByToken(String token);

    /**
     * Remove tokens whose access and refresh lifetimes have both ended.
     *
     * @return number of tokens removed
     */
    int deleteExpired(Instant now);
}
