package tech.ledgerbridge.broker.exchange;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.code.AuthorizationCode;
import tech.ledgerbridge.broker.code.AuthorizationCodeService;
import tech.ledgerbridge.broker.pkce.ChallengeStore;
import tech.ledgerbridge.broker.pkce.PkceChallenge;
import tech.ledgerbridge.broker.pkce.PkceService;
import tech.ledgerbridge.broker.shared.TokenGenerator;
import tech.ledgerbridge.broker.token.BrokerToken;
import tech.ledgerbridge.broker.token.BrokerTokenService;

import java.util.Optional;

/**
 * Exchanges an authorization code plus PKCE verifier for a broker token.
 *
 * <p>The code is marked used before the verifier is checked, so a failed attempt
 * burns the code.
 */
@ApplicationScoped
public class TokenExchangeOrchestrator {

    private static final Logger LOG = Logger.getLogger(TokenExchangeOrchestrator.class);

    @Inject
    AuthorizationCodeService authorizationCodes;

    @Inject
    ChallengeStore challengeStore;

    @Inject
    PkceService pkceService;

    @Inject
    BrokerTokenService brokerTokens;

    @Inject
    MeterRegistry registry;

    public ExchangeOutcome exchangeCode(String code, String codeVerifier, String clientId, String redirectUri) {
        if (isBlank(code)) {
            return ExchangeOutcome.Failed.invalidRequest("code is required");
        }
        if (isBlank(codeVerifier)) {
            return ExchangeOutcome.Failed.invalidRequest("code_verifier is required");
        }
        if (!pkceService.isValidCodeVerifier(codeVerifier)) {
            return ExchangeOutcome.Failed.invalidRequest(
                "code_verifier must be 43-128 characters of [A-Za-z0-9-._~]");
        }

        Optional<AuthorizationCode> consumed = authorizationCodes.consume(code);
        if (consumed.isEmpty()) {
            LOG.warnf("Token request with invalid, expired or reused authorization code %s", TokenGenerator.preview(code));
            return ExchangeOutcome.Failed.invalidGrant("Invalid or expired authorization code");
        }
        AuthorizationCode authCode = consumed.get();

        Optional<PkceChallenge> stored = challengeStore.find(authCode.outerState);
        if (stored.isEmpty()) {
            LOG.warnf("No PKCE challenge left for session %s", authCode.sessionId);
            return ExchangeOutcome.Failed.invalidGrant("Authorization request expired");
        }
        PkceChallenge challenge = stored.get();

        if (!pkceService.verify(challenge.method, codeVerifier, challenge.codeChallenge)) {
            registry.counter("ledgerbridge.pkce.failures").increment();
            LOG.warnf("PKCE verification failed for session %s (method %s)",
                authCode.sessionId, challenge.method.parameterValue());
            return ExchangeOutcome.Failed.invalidGrant("Invalid code_verifier");
        }

        if (clientId == null || !clientId.equals(challenge.clientId)) {
            LOG.warnf("Client mismatch for session %s: expected %s, got %s",
                authCode.sessionId, challenge.clientId, clientId);
            return ExchangeOutcome.Failed.invalidGrant("Client mismatch");
        }

        if (redirectUri != null && !redirectUri.equals(challenge.redirectUri)) {
            LOG.warnf("redirect_uri mismatch for session %s", authCode.sessionId);
            return ExchangeOutcome.Failed.invalidGrant("redirect_uri mismatch");
        }

        challengeStore.delete(challenge.outerState);
        BrokerToken token = brokerTokens.issue(authCode.sessionId);
        return new ExchangeOutcome.Issued(token);
    }

    /**
     * Rotate a broker refresh token.
     *
     * @param rejectedStatus status used when the refresh token is unknown or expired
     */
    public ExchangeOutcome refresh(String refreshToken, Response.Status rejectedStatus) {
        if (isBlank(refreshToken)) {
            return ExchangeOutcome.Failed.invalidRequest("refresh_token is required");
        }
        return brokerTokens.rotate(refreshToken)
            .<ExchangeOutcome>map(ExchangeOutcome.Issued::new)
            .orElseGet(() -> new ExchangeOutcome.Failed(rejectedStatus, "invalid_grant", "Invalid or expired refresh token"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
