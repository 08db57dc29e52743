package tech.ledgerbridge.broker.pkce;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import tech.ledgerbridge.broker.shared.ExpiresAtExpiry;

import java.util.Optional;

/**
 * In-memory challenge store using Caffeine.
 *
 * <p>Each entry lives until its own {@code expiresAt}. Losing entries on restart
 * only forces the outer client to restart its flow.
 */
@ApplicationScoped
public class InMemoryChallengeStore implements ChallengeStore {

    private final Cache<String, PkceChallenge> challenges = Caffeine.newBuilder()
        .expireAfter(new ExpiresAtExpiry<String, PkceChallenge>(c -> c.expiresAt))
        .build();

    @Override
    public Optional<PkceChallenge> find(String outerState) {
        if (outerState == null) {
            return Optional.empty();
        }
        PkceChallenge challenge = challenges.getIfPresent(outerState);
        if (challenge != null && challenge.isExpired()) {
            challenges.invalidate(outerState);
            return Optional.empty();
        }
        return Optional.ofNullable(challenge);
    }

    @Override
    public void store(PkceChallenge challenge) {
        challenges.put(challenge.outerState, challenge);
    }

    @Override
    public void delete(String outerState) {
        challenges.invalidate(outerState);
    }

    @Override
    public int sweepExpired() {
        long before = challenges.estimatedSize();
        challenges.cleanUp();
        return (int) Math.max(0, before - challenges.estimatedSize());
    }
}
