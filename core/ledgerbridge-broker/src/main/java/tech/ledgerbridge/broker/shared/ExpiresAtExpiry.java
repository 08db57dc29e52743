package tech.ledgerbridge.broker.shared;

import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;

/**
 * Caffeine expiry that evicts each entry at a deadline carried by the value itself.
 *
 * <p>Recomputed on create and update, untouched by reads.
 */
public final class ExpiresAtExpiry<K, V> implements Expiry<K, V> {

    private final Function<V, Instant> deadline;

    public ExpiresAtExpiry(Function<V, Instant> deadline) {
        this.deadline = deadline;
    }

    @Override
    public long expireAfterCreate(K key, V value, long currentTime) {
        return remainingNanos(value);
    }

    @Override
    public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
        return remainingNanos(value);
    }

    @Override
    public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
        return currentDuration;
    }

    private long remainingNanos(V value) {
        Instant at = deadline.apply(value);
        if (at == null) {
            return Long.MAX_VALUE;
        }
        try {
            return Math.max(0, Duration.between(Instant.now(), at).toNanos());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
