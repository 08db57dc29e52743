package tech.ledgerbridge.broker.code;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.shared.TokenGenerator;

import java.time.Instant;
import java.util.Optional;

@ApplicationScoped
public class AuthorizationCodeService {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeService.class);

    @Inject
    AuthorizationCodeStore store;

    @Inject
    BrokerConfig config;

    /**
     * Mint a single-use code binding a broker session to the outer client's state.
     */
    public AuthorizationCode mint(String sessionId, String outerState) {
        Instant now = Instant.now();

        AuthorizationCode code = new AuthorizationCode();
        code.code = TokenGenerator.authorizationCode();
        code.sessionId = sessionId;
        code.outerState = outerState;
        code.createdAt = now;
        code.expiresAt = now.plus(config.code().ttl());
        store.store(code);

        LOG.debugf("Minted authorization code %s for session %s", TokenGenerator.preview(code.code), sessionId);
        return code;
    }

    /**
     * Mark a code used and return it, or empty if it is unknown, expired or already used.
     */
    public Optional<AuthorizationCode> consume(String code) {
        return store.consume(code);
    }
}
