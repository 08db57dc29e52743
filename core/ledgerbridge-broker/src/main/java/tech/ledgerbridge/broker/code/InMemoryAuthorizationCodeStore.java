package tech.ledgerbridge.broker.code;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.shared.ExpiresAtExpiry;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory code store using Caffeine.
 *
 * <p>Unused codes are evicted at {@code expiresAt}; used codes are kept for the
 * configured retention after use, then evicted.
 */
@Singleton
public class InMemoryAuthorizationCodeStore implements AuthorizationCodeStore {

    private final Cache<String, AuthorizationCode> codes;

    @Inject
    public InMemoryAuthorizationCodeStore(BrokerConfig config) {
        this(config.code().usedRetention());
    }

    public InMemoryAuthorizationCodeStore(Duration usedRetention) {
        this.codes = Caffeine.newBuilder()
            .expireAfter(new ExpiresAtExpiry<String, AuthorizationCode>(c ->
                c.used ? c.usedAt.plus(usedRetention) : c.expiresAt))
            .build();
    }

    @Override
    public Optional<AuthorizationCode> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codes.getIfPresent(code));
    }

    @Override
    public void store(AuthorizationCode code) {
        codes.put(code.code, code);
    }

    @Override
    public Optional<AuthorizationCode> consume(String code) {
        if (code == null) {
            return Optional.empty();
        }

        AtomicReference<AuthorizationCode> consumed = new AtomicReference<>();
        codes.asMap().computeIfPresent(code, (key, existing) -> {
            if (existing.isValid()) {
                existing.used = true;
                existing.usedAt = Instant.now();
                consumed.set(existing);
            }
            return existing;
        });
        return Optional.ofNullable(consumed.get());
    }

    @Override
    public int sweepExpired() {
        long before = codes.estimatedSize();
        codes.cleanUp();
        return (int) Math.max(0, before - codes.estimatedSize());
    }
}
