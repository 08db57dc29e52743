package tech.ledgerbridge.broker.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.provider.ProviderTokens;
import tech.ledgerbridge.broker.shared.StorageRetry;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Tenant-level operations on company sessions.
 *
 * <p>Methods that read and then write a tenant's sessions expect the caller to hold
 * that tenant's lock.
 */
@ApplicationScoped
public class CompanySessionService {

    private static final Logger LOG = Logger.getLogger(CompanySessionService.class);

    @Inject
    CompanySessionRepository repository;

    @Inject
    StorageRetry storage;

    @Inject
    BrokerConfig config;

    /**
     * A session of this tenant whose tokens stay valid for at least the shared-session
     * safety margin, preferring the one that lives longest.
     */
    public Optional<CompanySession> findShareable(String tenantId) {
        return storage.call("company_sessions.findByTenantId", () -> repository.findByTenantId(tenantId))
            .stream()
            .filter(s -> !s.expiresWithin(config.session().sharedSafetyMargin()))
            .max(Comparator.comparing(s -> s.tokenExpiresAt));
    }

    /**
     * Give a new broker session its own copy of an existing tenant connection.
     */
    public CompanySession share(CompanySession source, String newSessionId) {
        CompanySession shared = source.shareWith(newSessionId);
        storage.run("company_sessions.persist", () -> repository.persist(shared));
        LOG.infof("Linked session %s to existing connection for tenant %s (shared)", newSessionId, source.tenantId);
        return shared;
    }

    /**
     * Store freshly consented tokens for a session and bring every other session of the
     * tenant up to date with them.
     */
    public CompanySession connect(String sessionId, String tenantId, ProviderTokens tokens) {
        Instant now = Instant.now();

        CompanySession session = new CompanySession();
        session.sessionId = sessionId;
        session.tenantId = tenantId;
        session.accessToken = tokens.accessToken();
        session.refreshToken = tokens.refreshToken();
        session.tokenExpiresAt = tokens.expiresAt(now);
        session.createdAt = now;

        storage.run("company_sessions.persist", () -> repository.persist(session));
        int updated = storage.call("company_sessions.updateTokensForTenant", () ->
            repository.updateTokensForTenant(tenantId, session.accessToken, session.refreshToken, session.tokenExpiresAt));

        LOG.infof("Stored new connection for tenant %s in session %s (%d session(s) now current)",
            tenantId, sessionId, updated);
        return session;
    }

    public Optional<CompanySession> find(String sessionId) {
        return storage.call("company_sessions.findBySessionId", () -> repository.findBySessionId(sessionId));
    }

    public void touch(String sessionId) {
        storage.run("company_sessions.touch", () -> repository.touch(sessionId, Instant.now()));
    }

    public int removeTenant(String tenantId) {
        return storage.call("company_sessions.deleteByTenantId", () -> repository.deleteByTenantId(tenantId));
    }
}
