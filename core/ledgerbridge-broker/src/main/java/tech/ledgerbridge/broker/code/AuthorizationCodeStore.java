package tech.ledgerbridge.broker.code;

import java.util.Optional;

/**
 * Short-lived, single-use authorization codes.
 */
public interface AuthorizationCodeStore {

    // Read operations
    Optional<AuthorizationCode> find(String code);

    // Write operations
    void store(AuthorizationCode code);

    /**
     * Atomically mark a code as used.
     *
     * <p>Exactly one caller receives the code; every later call, and any call for an
     * unknown or expired code, receives empty.
     */
    Optional<AuthorizationCode> consume(String code);

    int sweepExpired();
}
