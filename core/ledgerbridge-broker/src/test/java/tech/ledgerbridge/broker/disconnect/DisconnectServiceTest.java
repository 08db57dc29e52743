package tech.ledgerbridge.broker.disconnect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.ledgerbridge.broker.TestBrokerConfig;
import tech.ledgerbridge.broker.lock.InProcessTenantLock;
import tech.ledgerbridge.broker.lock.LockTimeoutException;
import tech.ledgerbridge.broker.lock.TenantLock;
import tech.ledgerbridge.broker.session.InMemoryCompanySessionRepository;
import tech.ledgerbridge.broker.session.SessionTestFixtures;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class DisconnectServiceTest {

    private TestBrokerConfig config;
    private InMemoryCompanySessionRepository sessions;
    private InProcessTenantLock lock;
    private DisconnectService service;

    @BeforeEach
    void setUp() {
        config = new TestBrokerConfig();
        sessions = new InMemoryCompanySessionRepository();
        lock = new InProcessTenantLock();

        service = new DisconnectService();
        service.companySessions = SessionTestFixtures.service(sessions, config);
        service.tenantLock = lock;
        service.config = config;
    }

    @Test
    @DisplayName("disconnect should remove every session of the tenant")
    void disconnect_shouldRemoveTenantSessions() {
        sessions.persist(SessionTestFixtures.session("a", "realm-1", Duration.ofMinutes(50)));
        sessions.persist(SessionTestFixtures.session("b", "realm-1", Duration.ofMinutes(50)));
        sessions.persist(SessionTestFixtures.session("c", "realm-2", Duration.ofMinutes(50)));

        int removed = service.disconnect("realm-1");

        assertThat(removed).isEqualTo(2);
        assertThat(sessions.findByTenantId("realm-1")).isEmpty();
        assertThat(sessions.findByTenantId("realm-2")).hasSize(1);
    }

    @Test
    @DisplayName("disconnect should report zero for an unknown tenant")
    void disconnect_shouldReturnZero_whenTenantUnknown() {
        assertThat(service.disconnect("realm-9")).isZero();
    }

    @Test
    @DisplayName("disconnect should wait for the tenant lock")
    void disconnect_shouldTimeOut_whenTenantLockedElsewhere() throws Exception {
        config.lockWaitTimeout = Duration.ofMillis(50);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (TenantLock.LockHandle ignored = lock.acquire("realm-1", Duration.ofSeconds(1))) {
                held.countDown();
                done.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        holder.start();
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> service.disconnect("realm-1")).isInstanceOf(LockTimeoutException.class);
        } finally {
            done.countDown();
            holder.join(5000);
        }
    }
}
