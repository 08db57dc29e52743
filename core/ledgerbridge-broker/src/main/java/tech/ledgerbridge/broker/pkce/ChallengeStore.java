package tech.ledgerbridge.broker.pkce;

import java.util.Optional;

/**
 * Short-lived PKCE challenges keyed by outer state.
 */
public interface ChallengeStore {

    // Read operations
    Optional<PkceChallenge> find(String outerState);

    // Write operations
    void store(PkceChallenge challenge);
    void delete(String outerState);

    /**
     * Drop expired challenges.
     *
     * @return number of challenges removed
     */
    int sweepExpired();
}
