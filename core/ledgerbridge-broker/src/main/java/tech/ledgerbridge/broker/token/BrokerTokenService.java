package tech.ledgerbridge.broker.token;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.shared.StorageRetry;
import tech.ledgerbridge.broker.shared.TokenGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Issues, resolves and rotates broker bearer tokens.
 */
@ApplicationScoped
public class BrokerTokenService {

    private static final Logger LOG = Logger.getLogger(BrokerTokenService.class);

    @Inject
    BrokerTokenRepository repository;

    @Inject
    StorageRetry storage;

    @Inject
    BrokerConfig config;

    /**
     * Mint and persist a broker token for a session.
     * The token is durable before this method returns.
     */
    public BrokerToken issue(String sessionId) {
        Instant now = Instant.now();

        BrokerToken token = new BrokerToken();
        token.token = TokenGenerator.brokerToken();
        token.sessionId = sessionId;
        token.issuedAt = now;
        token.expiresAt = now.plus(config.token().accessTokenTtl());
        if (config.token().refreshTokensEnabled()) {
            token.refreshToken = TokenGenerator.authorizationCode();
            token.refreshTokenExpiresAt = now.plus(config.token().refreshTokenTtl());
        }

        storage.run("broker_tokens.persist", () -> repository.persist(token));
        LOG.infof("Issued broker token %s for session %s (expires %s)",
            TokenGenerator.preview(token.token), sessionId, token.expiresAt);
        return token;
    }

    /**
     * Look up an unexpired broker token.
     */
    public Optional<BrokerToken> resolve(String bearer) {
        if (bearer == null || bearer.isBlank()) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        return storage.call("broker_tokens.findByToken", () -> repository.findByToken(bearer))
            .filter(t -> !t.isExpired(now));
    }

    /**
     * Exchange a broker refresh token for a new access token and a new refresh token.
     * The presented pair is revoked; only one of several concurrent rotations succeeds.
     *
     * @return the new token, or empty if refresh is disabled or the refresh token is
     *         unknown, expired or already rotated
     */
    public Optional<BrokerToken> rotate(String refreshToken) {
        if (!config.token().refreshTokensEnabled() || refreshToken == null || refreshToken.isBlank()) {
            return Optional.empty();
        }

        Optional<BrokerToken> current = storage.call("broker_tokens.findByRefreshToken",
            () -> repository.findByRefreshToken(refreshToken));
        if (current.isEmpty() || current.get().isRefreshTokenExpired(Instant.now())) {
            LOG.warnf("Rejected broker refresh token %s", TokenGenerator.preview(refreshToken));
            return Optional.empty();
        }

        BrokerToken old = current.get();
        boolean revoked = storage.call("broker_tokens.deleteByToken", () -> repository.deleteByToken(old.token));
        if (!revoked) {
            LOG.warnf("Broker refresh token %s was already rotated", TokenGenerator.preview(refreshToken));
            return Optional.empty();
        }

        BrokerToken next = issue(old.sessionId);
        LOG.infof("Rotated broker token for session %s", old.sessionId);
        return Optional.of(next);
    }

    @Scheduled(every = "${ledgerbridge.sweep.broker-token-interval:1h}", identity = "broker-token-sweep")
    void sweepExpired() {
        int removed = storage.call("broker_tokens.deleteExpired", () -> repository.deleteExpired(Instant.now()));
        if (removed > 0) {
            LOG.infof("Removed %d expired broker token(s)", removed);
        }
    }
}
