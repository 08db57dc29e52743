package tech.ledgerbridge.broker.gate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.lock.LockTimeoutException;
import tech.ledgerbridge.broker.refresh.ReauthorizationRequiredException;
import tech.ledgerbridge.broker.refresh.RefreshOutcome;
import tech.ledgerbridge.broker.refresh.RefreshUnavailableException;
import tech.ledgerbridge.broker.refresh.TokenRefreshService;
import tech.ledgerbridge.broker.session.CompanySession;
import tech.ledgerbridge.broker.session.CompanySessionService;
import tech.ledgerbridge.broker.shared.StorageUnavailableException;
import tech.ledgerbridge.broker.shared.TokenGenerator;
import tech.ledgerbridge.broker.token.BrokerToken;
import tech.ledgerbridge.broker.token.BrokerTokenService;

import java.util.Optional;

/**
 * Resolves a bearer token to the tenant credentials a protected call runs with,
 * refreshing the tenant's third-party tokens on the way when they are about to expire.
 */
@ApplicationScoped
public class RequestAuthenticator {

    private static final Logger LOG = Logger.getLogger(RequestAuthenticator.class);
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    BrokerTokenService brokerTokens;

    @Inject
    CompanySessionService companySessions;

    @Inject
    TokenRefreshService tokenRefresh;

    /**
     * @param authorizationHeader raw Authorization header, may be null
     * @throws GateRejectedException when the call must not proceed
     */
    public AuthenticatedTenant authenticate(String authorizationHeader) {
        String bearer = extractBearerToken(authorizationHeader)
            .orElseThrow(() -> new GateRejectedException(GateFailure.MISSING_CREDENTIALS, "no bearer token"));

        BrokerToken token = brokerTokens.resolve(bearer)
            .orElseThrow(() -> {
                LOG.warnf("Rejected unknown or expired broker token %s", TokenGenerator.preview(bearer));
                return new GateRejectedException(GateFailure.INVALID_TOKEN, "unknown or expired broker token");
            });

        String sessionId = token.sessionId;
        if (companySessions.find(sessionId).isEmpty()) {
            LOG.warnf("No company session for broker session %s", sessionId);
            throw new GateRejectedException(GateFailure.SESSION_NOT_FOUND, "session " + sessionId);
        }

        try {
            RefreshOutcome outcome = tokenRefresh.refreshIfNeeded(sessionId);
            if (outcome != RefreshOutcome.NOT_NEEDED) {
                LOG.debugf("Tenant tokens for session %s: %s", sessionId, outcome);
            }
        } catch (ReauthorizationRequiredException e) {
            LOG.warnf("Session %s needs reauthorization: %s", sessionId, e.getMessage());
            throw new GateRejectedException(GateFailure.REAUTHORIZATION_REQUIRED, e.getMessage(), e);
        } catch (RefreshUnavailableException | LockTimeoutException | StorageUnavailableException e) {
            LOG.warnf("Session %s could not be refreshed right now: %s", sessionId, e.getMessage());
            throw new GateRejectedException(GateFailure.TEMPORARILY_UNAVAILABLE, e.getMessage(), e);
        }

        CompanySession session = companySessions.find(sessionId)
            .orElseThrow(() -> {
                LOG.errorf("Company session %s disappeared after refresh", sessionId);
                return new GateRejectedException(GateFailure.SESSION_ERROR, "session lost after refresh");
            });

        companySessions.touch(sessionId);
        return new AuthenticatedTenant(session.tenantId, session.accessToken, sessionId);
    }

    static Optional<String> extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
