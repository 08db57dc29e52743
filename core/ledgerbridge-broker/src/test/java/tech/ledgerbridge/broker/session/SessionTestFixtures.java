package tech.ledgerbridge.broker.session;

import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.shared.StorageRetry;

import java.time.Duration;
import java.time.Instant;

public final class SessionTestFixtures {

    private SessionTestFixtures() {
    }

    public static CompanySessionService service(CompanySessionRepository repository, BrokerConfig config) {
        CompanySessionService service = new CompanySessionService();
        service.repository = repository;
        service.storage = new StorageRetry(config);
        service.config = config;
        return service;
    }

    public static CompanySession session(String sessionId, String tenantId, Duration validFor) {
        CompanySession session = new CompanySession();
        session.sessionId = sessionId;
        session.tenantId = tenantId;
        session.accessToken = "access-" + sessionId;
        session.refreshToken = "refresh-" + tenantId;
        session.tokenExpiresAt = Instant.now().plus(validFor);
        return session;
    }
}
