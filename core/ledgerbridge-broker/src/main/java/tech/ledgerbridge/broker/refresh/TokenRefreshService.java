package tech.ledgerbridge.broker.refresh;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.lock.TenantLock;
import tech.ledgerbridge.broker.provider.ProviderTokens;
import tech.ledgerbridge.broker.provider.ThirdPartyAuthException;
import tech.ledgerbridge.broker.provider.ThirdPartyUnavailableException;
import tech.ledgerbridge.broker.provider.ThirdPartyOAuthClient;
import tech.ledgerbridge.broker.session.CompanySession;
import tech.ledgerbridge.broker.session.CompanySessionRepository;
import tech.ledgerbridge.broker.shared.StorageRetry;

import java.time.Duration;
import java.time.Instant;

/**
 * Keeps tenant access tokens fresh.
 *
 * <p>Refresh is serialized per tenant rather than per session: every session of a
 * tenant holds the same rotating refresh token, and two refreshes racing with it
 * would invalidate each other. The winner writes the new tokens to every session
 * of the tenant.
 */
@ApplicationScoped
public class TokenRefreshService {

    private static final Logger LOG = Logger.getLogger(TokenRefreshService.class);

    @Inject
    CompanySessionRepository sessions;

    @Inject
    TenantLock tenantLock;

    @Inject
    ThirdPartyOAuthClient provider;

    @Inject
    StorageRetry storage;

    @Inject
    BrokerConfig config;

    @Inject
    MeterRegistry registry;

    /**
     * Refresh the session's tenant tokens if they expire within the refresh threshold.
     *
     * @throws ReauthorizationRequiredException if the session is gone or the third party
     *         refuses the refresh
     * @throws RefreshUnavailableException if the third party cannot be reached
     * @throws tech.ledgerbridge.broker.lock.LockTimeoutException if the tenant lock is
     *         not obtained in time
     */
    public RefreshOutcome refreshIfNeeded(String sessionId) {
        Duration threshold = config.session().refreshThreshold();

        CompanySession session = load(sessionId);
        if (!session.expiresWithin(threshold)) {
            return RefreshOutcome.NOT_NEEDED;
        }

        String tenantId = session.tenantId;
        LOG.infof("Tenant %s token expires at %s, refreshing", tenantId, session.tokenExpiresAt);

        try (TenantLock.LockHandle ignored = tenantLock.acquire(tenantId, config.lock().waitTimeout())) {
            CompanySession current = load(sessionId);
            if (!current.expiresWithin(threshold)) {
                LOG.infof("Tenant %s was refreshed by another caller", tenantId);
                registry.counter("ledgerbridge.refresh", "outcome", "shared").increment();
                return RefreshOutcome.REFRESHED_BY_ANOTHER_CALLER;
            }

            ProviderTokens tokens;
            try {
                tokens = provider.refresh(current.refreshToken);
            } catch (ThirdPartyUnavailableException | CircuitBreakerOpenException e) {
                registry.counter("ledgerbridge.refresh", "outcome", "unavailable").increment();
                LOG.warnf("Third party unavailable while refreshing tenant %s: %s", tenantId, e.getMessage());
                throw new RefreshUnavailableException(tenantId,
                    "Third party unavailable while refreshing tenant " + tenantId, e);
            } catch (ThirdPartyAuthException e) {
                registry.counter("ledgerbridge.refresh", "outcome", "failed").increment();
                LOG.errorf("Third-party refresh failed for tenant %s: %s (%s)", tenantId, e.getMessage(), e.getError());
                throw new ReauthorizationRequiredException(tenantId,
                    "Third-party refresh failed for tenant " + tenantId, e);
            }

            Instant expiresAt = tokens.expiresAt(Instant.now());
            int updated = storage.call("company_sessions.updateTokensForTenant", () ->
                sessions.updateTokensForTenant(tenantId, tokens.accessToken(), tokens.refreshToken(), expiresAt));

            registry.counter("ledgerbridge.refresh", "outcome", "refreshed").increment();
            LOG.infof("Refreshed tenant %s; updated %d session(s), new expiry %s", tenantId, updated, expiresAt);
            return RefreshOutcome.REFRESHED;
        }
    }

    private CompanySession load(String sessionId) {
        return storage.call("company_sessions.findBySessionId", () -> sessions.findBySessionId(sessionId))
            .orElseThrow(() -> new ReauthorizationRequiredException(null,
                "Company session not found: " + sessionId));
    }
}
