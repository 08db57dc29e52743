package tech.ledgerbridge.broker.shared;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.code.AuthorizationCodeStore;
import tech.ledgerbridge.broker.pkce.ChallengeStore;
import tech.ledgerbridge.broker.state.StateBridgeStore;

/**
 * Periodically drops expired challenges, bridge entries and authorization codes.
 * Reads already ignore expired entries; the sweep only bounds memory.
 */
@ApplicationScoped
public class ShortLivedStoreSweeper {

    private static final Logger LOG = Logger.getLogger(ShortLivedStoreSweeper.class);

    @Inject
    ChallengeStore challengeStore;

    @Inject
    StateBridgeStore stateBridgeStore;

    @Inject
    AuthorizationCodeStore authorizationCodeStore;

    @Scheduled(every = "${ledgerbridge.sweep.short-lived-interval:2m}", identity = "short-lived-store-sweep")
    void sweep() {
        int challenges = challengeStore.sweepExpired();
        int states = stateBridgeStore.sweepExpired();
        int codes = authorizationCodeStore.sweepExpired();

        if (challenges + states + codes > 0) {
            LOG.debugf("Swept expired entries: %d challenge(s), %d state(s), %d code(s)", challenges, states, codes);
        }
    }
}
