package tech.ledgerbridge.broker.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.ledgerbridge.broker.TestBrokerConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class StateBridgeTest {

    private TestBrokerConfig config;
    private InMemoryStateBridgeStore store;
    private StateBridge bridge;

    @BeforeEach
    void setUp() {
        config = new TestBrokerConfig();
        store = new InMemoryStateBridgeStore();
        bridge = StateTestFixtures.bridge(store, config);
    }

    @Test
    @DisplayName("redeem should return outer state and session for an issued token")
    void redeem_shouldReturnEntry_whenTokenIssued() {
        // Arrange
        String token = bridge.issue("s1", "session-1");

        // Act
        Optional<StateBridgeEntry> entry = bridge.redeem(token);

        // Assert
        assertThat(entry).isPresent();
        assertThat(entry.get().outerState).isEqualTo("s1");
        assertThat(entry.get().sessionId).isEqualTo("session-1");
    }

    @Test
    @DisplayName("redeem should succeed only once per token")
    void redeem_shouldFail_whenTokenAlreadyRedeemed() {
        String token = bridge.issue("s1", "session-1");

        assertThat(bridge.redeem(token)).isPresent();
        assertThat(bridge.redeem(token)).isEmpty();
    }

    @Test
    @DisplayName("issue should produce distinct tokens for identical flows")
    void issue_shouldProduceDistinctTokens() {
        assertThat(bridge.issue("s1", "session-1")).isNotEqualTo(bridge.issue("s1", "session-1"));
    }

    @Test
    @DisplayName("redeem should reject a well-formed token that was never issued")
    void redeem_shouldReject_whenTokenNotIssued() {
        String forged = new InnerStateCodec().encode(new InnerState(1, "s1", "session-1", "n", 0L));

        assertThat(bridge.redeem(forged)).isEmpty();
    }

    @Test
    @DisplayName("redeem should reject expired entries")
    void redeem_shouldReject_whenEntryExpired() {
        String token = new InnerStateCodec().encode(new InnerState(1, "s1", "session-1", "n", 0L));
        StateBridgeEntry entry = new StateBridgeEntry();
        entry.innerState = token;
        entry.outerState = "s1";
        entry.sessionId = "session-1";
        entry.createdAt = Instant.now().minus(Duration.ofMinutes(11));
        entry.expiresAt = Instant.now().minusSeconds(1);
        store.store(entry);

        assertThat(bridge.redeem(token)).isEmpty();
    }

    @Test
    @DisplayName("redeem should reject malformed tokens")
    void redeem_shouldReject_whenTokenMalformed() {
        assertThat(bridge.redeem("%%%")).isEmpty();
        assertThat(bridge.redeem(null)).isEmpty();
    }
}
