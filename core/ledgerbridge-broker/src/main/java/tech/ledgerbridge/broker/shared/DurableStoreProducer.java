package tech.ledgerbridge.broker.shared;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.session.CompanySessionRepository;
import tech.ledgerbridge.broker.session.InMemoryCompanySessionRepository;
import tech.ledgerbridge.broker.session.panache.PanacheCompanySessionRepository;
import tech.ledgerbridge.broker.token.BrokerTokenRepository;
import tech.ledgerbridge.broker.token.InMemoryBrokerTokenRepository;
import tech.ledgerbridge.broker.token.panache.PanacheBrokerTokenRepository;

/**
 * CDI producer that selects the company session and broker token stores
 * based on configuration.
 */
@ApplicationScoped
public class DurableStoreProducer {

    private static final Logger LOG = Logger.getLogger(DurableStoreProducer.class);

    @Inject
    BrokerConfig config;

    @Inject
    Instance<InMemoryCompanySessionRepository> inMemorySessions;

    @Inject
    Instance<PanacheCompanySessionRepository> panacheSessions;

    @Inject
    Instance<InMemoryBrokerTokenRepository> inMemoryTokens;

    @Inject
    Instance<PanacheBrokerTokenRepository> panacheTokens;

    @Produces
    @ApplicationScoped
    public CompanySessionRepository companySessionRepository() {
        BrokerConfig.StorageType type = config.storage().type();
        LOG.infof("Initializing company session store: type=%s", type);

        return switch (type) {
            case MEMORY -> {
                LOG.warn("Company sessions are held in memory and will not survive a restart");
                yield inMemorySessions.get();
            }
            case DATABASE -> panacheSessions.get();
        };
    }

    @Produces
    @ApplicationScoped
    public BrokerTokenRepository brokerTokenRepository() {
        BrokerConfig.StorageType type = config.storage().type();
        LOG.infof("Initializing broker token store: type=%s", type);

        return switch (type) {
            case MEMORY -> inMemoryTokens.get();
            case DATABASE -> panacheTokens.get();
        };
    }
}
