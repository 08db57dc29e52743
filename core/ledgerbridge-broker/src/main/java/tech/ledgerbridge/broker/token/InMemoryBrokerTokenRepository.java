package tech.ledgerbridge.broker.token;

import jakarta.enterprise.inject.Typed;
import jakarta.inject.Singleton;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local broker tokens. Lost on restart; intended for development and tests.
 */
@Singleton
@Typed(InMemoryBrokerTokenRepository.class)
public class InMemoryBrokerTokenRepository implements BrokerTokenRepository {

    private final ConcurrentMap<String, BrokerToken> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<BrokerToken> findByToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(token)).map(BrokerToken::copy);
    }

    @Override
    public Optional<BrokerToken> findByRefreshToken(String refreshToken) {
        if (refreshToken == null) {
            return Optional.empty();
        }
        return tokens.values().stream()
            .filter(t -> refreshToken.equals(t.refreshToken))
            .findFirst()
            .map(BrokerToken::copy);
    }

    @Override
    public void persist(BrokerToken token) {
        tokens.put(token.token, token.copy());
    }

    @Override
    public boolean deleteByToken(String token) {
        return token != null && tokens.remove(token) != null;
    }

    @Override
    public int deleteExpired(Instant now) {
        int removed = 0;
        for (var entry : tokens.entrySet()) {
            BrokerToken t = entry.getValue();
            if (t.isExpired(now) && t.isRefreshTokenExpired(now) && tokens.remove(entry.getKey(), t)) {
                removed++;
            }
        }
        return removed;
    }
}
