package tech.ledgerbridge.broker.state;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import tech.ledgerbridge.broker.shared.ExpiresAtExpiry;

import java.util.Optional;

@ApplicationScoped
public class InMemoryStateBridgeStore implements StateBridgeStore {

    private final Cache<String, StateBridgeEntry> entries = Caffeine.newBuilder()
        .expireAfter(new ExpiresAtExpiry<String, StateBridgeEntry>(e -> e.expiresAt))
        .build();

    @Override
    public void store(StateBridgeEntry entry) {
        entries.put(entry.innerState, entry);
    }

    @Override
    public Optional<StateBridgeEntry> take(String innerState) {
        if (innerState == null) {
            return Optional.empty();
        }
        StateBridgeEntry entry = entries.asMap().remove(innerState);
        if (entry == null || entry.isExpired()) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public int sweepExpired() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        return (int) Math.max(0, before - entries.estimatedSize());
    }
}
