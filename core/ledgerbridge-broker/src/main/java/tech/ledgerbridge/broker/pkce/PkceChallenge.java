package tech.ledgerbridge.broker.pkce;

import java.time.Instant;

/**
 * Code challenge received on /authorize, waiting for the matching verifier on /token.
 *
 * Keyed by the outer client's state parameter, which the authorization code
 * carries through the third-party leg.
 */
public class PkceChallenge {

    public String outerState;

    public String codeChallenge;

    public ChallengeMethod method;

    /**
     * Where the outer client expects its authorization code.
     */
    public String redirectUri;

    /**
     * Client that started the flow; the token request must present the same id.
     */
    public String clientId;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean isExpired() {
        return Instant.now().isAfter(expiresAt);
    }
}
