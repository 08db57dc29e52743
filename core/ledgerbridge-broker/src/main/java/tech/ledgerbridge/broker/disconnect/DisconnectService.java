package tech.ledgerbridge.broker.disconnect;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.lock.TenantLock;
import tech.ledgerbridge.broker.session.CompanySessionService;

/**
 * Removes every broker session connected to a tenant.
 *
 * Broker tokens of those sessions stay valid but lead to a session-not-found rejection
 * at the gate until the user connects again.
 */
@ApplicationScoped
public class DisconnectService {

    private static final Logger LOG = Logger.getLogger(DisconnectService.class);

    @Inject
    CompanySessionService companySessions;

    @Inject
    TenantLock tenantLock;

    @Inject
    BrokerConfig config;

    /**
     * @return number of sessions removed
     */
    public int disconnect(String tenantId) {
        try (TenantLock.LockHandle ignored = tenantLock.acquire(tenantId, config.lock().waitTimeout())) {
            int removed = companySessions.removeTenant(tenantId);
            LOG.infof("Disconnected tenant %s (%d session(s) removed)", tenantId, removed);
            return removed;
        }
    }
}
