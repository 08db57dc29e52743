package tech.ledgerbridge.broker.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class BrokerTokenTest {

    @Test
    @DisplayName("isExpired should accept a token through its expiry instant and reject it after")
    void isExpired_shouldHonourInclusiveBoundary() {
        Instant issuedAt = Instant.parse("2026-01-01T00:00:00Z");
        BrokerToken token = new BrokerToken();
        token.token = "mcp_x";
        token.issuedAt = issuedAt;
        token.expiresAt = issuedAt.plus(Duration.ofSeconds(3600));

        assertThat(token.isExpired(issuedAt.plusSeconds(3599))).isFalse();
        assertThat(token.isExpired(issuedAt.plusSeconds(3600))).isFalse();
        assertThat(token.isExpired(issuedAt.plusSeconds(3600).plusNanos(1))).isTrue();
        assertThat(token.isExpired(issuedAt.plusSeconds(3601))).isTrue();
    }

    @Test
    @DisplayName("isRefreshTokenExpired should treat a missing refresh token as expired")
    void isRefreshTokenExpired_shouldBeTrue_whenNoRefreshToken() {
        BrokerToken token = new BrokerToken();
        token.expiresAt = Instant.now().plusSeconds(60);

        assertThat(token.isRefreshTokenExpired(Instant.now())).isTrue();
    }
}
