package tech.ledgerbridge.broker.session.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * JPA entity for company_sessions table.
 */
@Entity
@Table(name = "company_sessions", indexes = {
    @Index(name = "idx_company_sessions_tenant_id", columnList = "tenant_id")
})
public class CompanySessionEntity {

    @Id
    @Column(name = "session_id", length = 36)
    public String sessionId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    public String tenantId;

    @Column(name = "access_token", nullable = false, columnDefinition = "TEXT")
    public String accessToken;

    @Column(name = "refresh_token", nullable = false, columnDefinition = "TEXT")
    public String refreshToken;

    @Column(name = "token_expires_at", nullable = false)
    public Instant tokenExpiresAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_used_at")
    public Instant lastUsedAt;

    public CompanySessionEntity() {
    }
}
