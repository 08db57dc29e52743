package tech.ledgerbridge.broker.provider;

import java.time.Instant;

/**
 * Tokens returned by the third party's token endpoint.
 *
 * @param expiresInSeconds lifetime of the access token
 */
public record ProviderTokens(String accessToken, String refreshToken, long expiresInSeconds) {

    public Instant expiresAt(Instant issuedAt) {
        return issuedAt.plusSeconds(expiresInSeconds);
    }
}
