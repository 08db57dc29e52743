package tech.ledgerbridge.broker.token;

import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.shared.StorageRetry;

public final class TokenTestFixtures {

    private TokenTestFixtures() {
    }

    public static BrokerTokenService service(BrokerTokenRepository repository, BrokerConfig config) {
        BrokerTokenService service = new BrokerTokenService();
        service.repository = repository;
        service.storage = new StorageRetry(config);
        service.config = config;
        return service;
    }
}
