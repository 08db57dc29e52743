package tech.ledgerbridge.broker.token.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * JPA entity for broker_tokens table.
 */
@Entity
@Table(name = "broker_tokens", indexes = {
    @Index(name = "idx_broker_tokens_refresh_token", columnList = "refresh_token", unique = true),
    @Index(name = "idx_broker_tokens_session_id", columnList = "session_id")
})
public class BrokerTokenEntity {

    @Id
    @Column(name = "token", length = 68)
    public String token;

    @Column(name = "session_id", nullable = false, length = 36)
    public String sessionId;

    @Column(name = "issued_at", nullable = false)
    public Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "refresh_token", length = 64)
    public String refreshToken;

    @Column(name = "refresh_token_expires_at")
    public Instant refreshTokenExpiresAt;

    public BrokerTokenEntity() {
    }
}
