package tech.ledgerbridge.broker.state;

import java.util.Optional;

/**
 * Short-lived bridge entries keyed by inner state token.
 */
public interface StateBridgeStore {

    void store(StateBridgeEntry entry);

    /**
     * Atomically remove and return an unexpired entry.
     */
    Optional<StateBridgeEntry> take(String innerState);

    int sweepExpired();
}
