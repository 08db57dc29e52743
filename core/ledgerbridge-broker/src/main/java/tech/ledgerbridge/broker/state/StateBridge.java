package tech.ledgerbridge.broker.state;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.shared.TokenGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Carries the outer flow across the third-party redirect.
 *
 * <p>A token is only honoured while its entry is in the store, so a token that
 * decodes cleanly but was already redeemed or has expired is rejected.
 */
@ApplicationScoped
public class StateBridge {

    private static final Logger LOG = Logger.getLogger(StateBridge.class);

    @Inject
    StateBridgeStore store;

    @Inject
    InnerStateCodec codec;

    @Inject
    BrokerConfig config;

    /**
     * Create and remember the inner state token for a new third-party authorization.
     */
    public String issue(String outerState, String sessionId) {
        Instant now = Instant.now();
        InnerState state = new InnerState(
            InnerStateCodec.CURRENT_VERSION,
            outerState,
            sessionId,
            TokenGenerator.nonce(),
            now.toEpochMilli()
        );
        String token = codec.encode(state);

        StateBridgeEntry entry = new StateBridgeEntry();
        entry.innerState = token;
        entry.outerState = outerState;
        entry.sessionId = sessionId;
        entry.createdAt = now;
        entry.expiresAt = now.plus(config.state().ttl());
        store.store(entry);

        LOG.debugf("Issued inner state for session %s", sessionId);
        return token;
    }

    /**
     * Redeem an inner state token returned by the third party. A token can be
     * redeemed once; concurrent callbacks carrying the same token see one winner.
     *
     * @return the bridge entry, or empty if the token is malformed, unknown, expired
     *         or already redeemed
     */
    public Optional<StateBridgeEntry> redeem(String innerState) {
        InnerState decoded;
        try {
            decoded = codec.decode(innerState);
        } catch (InvalidInnerStateException e) {
            LOG.warnf("Rejected inner state: %s", e.getMessage());
            return Optional.empty();
        }

        Optional<StateBridgeEntry> entry = store.take(innerState);
        if (entry.isEmpty()) {
            LOG.warnf("Inner state for session %s is unknown, expired or already used", decoded.sessionId());
            return Optional.empty();
        }

        StateBridgeEntry found = entry.get();
        if (!found.sessionId.equals(decoded.sessionId()) || !found.outerState.equals(decoded.outerState())) {
            LOG.warnf("Inner state payload does not match its bridge entry (session %s)", found.sessionId);
            return Optional.empty();
        }
        return entry;
    }
}
