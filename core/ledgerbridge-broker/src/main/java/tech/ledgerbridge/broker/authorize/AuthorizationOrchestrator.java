package tech.ledgerbridge.broker.authorize;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.code.AuthorizationCode;
import tech.ledgerbridge.broker.code.AuthorizationCodeService;
import tech.ledgerbridge.broker.lock.TenantLock;
import tech.ledgerbridge.broker.pkce.ChallengeMethod;
import tech.ledgerbridge.broker.pkce.ChallengeStore;
import tech.ledgerbridge.broker.pkce.PkceChallenge;
import tech.ledgerbridge.broker.provider.ThirdPartyOAuthClient;
import tech.ledgerbridge.broker.session.CompanySession;
import tech.ledgerbridge.broker.session.CompanySessionService;
import tech.ledgerbridge.broker.shared.RedirectUris;
import tech.ledgerbridge.broker.shared.TokenGenerator;
import tech.ledgerbridge.broker.state.StateBridge;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Handles the outer client's authorization request.
 *
 * <p>The user is normally sent to the third party to consent; the company is only known
 * once the provider calls back. A single-company deployment may configure a default
 * tenant: when that tenant is connected with tokens valid for the shared-session safety
 * margin, the new session reuses the connection and the client is sent straight back
 * with a code. That decision is taken under the tenant lock so a concurrent first
 * connection is observed rather than duplicated.
 */
@ApplicationScoped
public class AuthorizationOrchestrator {

    private static final Logger LOG = Logger.getLogger(AuthorizationOrchestrator.class);

    @Inject
    ChallengeStore challengeStore;

    @Inject
    StateBridge stateBridge;

    @Inject
    CompanySessionService companySessions;

    @Inject
    AuthorizationCodeService authorizationCodes;

    @Inject
    TenantLock tenantLock;

    @Inject
    ThirdPartyOAuthClient provider;

    @Inject
    RedirectUriPolicy redirectUriPolicy;

    @Inject
    BrokerConfig config;

    /**
     * @throws tech.ledgerbridge.broker.provider.ProviderNotConfiguredException if the
     *         third-party client is not configured
     */
    public AuthorizeOutcome authorize(AuthorizeRequest request) {
        Optional<AuthorizeOutcome.Rejected> rejection = validate(request);
        if (rejection.isPresent()) {
            LOG.warnf("Rejected authorization request: %s", rejection.get().description());
            return rejection.get();
        }

        storeChallenge(request);

        String sessionId = TokenGenerator.sessionId();
        Optional<String> defaultTenant = config.defaultTenantId().filter(t -> !t.isBlank());

        if (defaultTenant.isEmpty()) {
            return redirectToProvider(request.state(), sessionId);
        }

        String tenantId = defaultTenant.get();
        try (TenantLock.LockHandle ignored = tenantLock.acquire(tenantId, config.lock().waitTimeout())) {
            Optional<CompanySession> existing = companySessions.findShareable(tenantId);
            if (existing.isEmpty()) {
                LOG.infof("No shareable connection for tenant %s, requesting consent", tenantId);
                return redirectToProvider(request.state(), sessionId);
            }

            companySessions.share(existing.get(), sessionId);
            AuthorizationCode code = authorizationCodes.mint(sessionId, request.state());

            Map<String, String> params = new LinkedHashMap<>();
            params.put("code", code.code);
            params.put("state", request.state());
            URI location = RedirectUris.withQuery(request.redirectUri(), params);

            LOG.infof("Tenant %s already connected; session %s returns to client without consent", tenantId, sessionId);
            return new AuthorizeOutcome.RedirectToClient(location, sessionId);
        }
    }

    Optional<AuthorizeOutcome.Rejected> validate(AuthorizeRequest request) {
        if (isBlank(request.responseType())) {
            return reject("response_type", "Missing required parameter: response_type");
        }
        if (!"code".equals(request.responseType())) {
            return reject("response_type", "Invalid response_type: " + request.responseType() + " (must be \"code\")");
        }
        if (isBlank(request.clientId())) {
            return reject("client_id", "Missing required parameter: client_id");
        }
        if (isBlank(request.redirectUri())) {
            return reject("redirect_uri", "Missing required parameter: redirect_uri");
        }
        if (isBlank(request.codeChallenge())) {
            return reject("code_challenge", "Missing required parameter: code_challenge (PKCE is required)");
        }
        if (isBlank(request.codeChallengeMethod())) {
            return reject("code_challenge_method", "Missing required parameter: code_challenge_method");
        }
        if (ChallengeMethod.fromParameter(request.codeChallengeMethod()).isEmpty()) {
            return reject("code_challenge_method",
                "Invalid code_challenge_method: " + request.codeChallengeMethod() + " (must be \"S256\" or \"plain\")");
        }
        if (isBlank(request.state())) {
            return reject("state", "Missing required parameter: state");
        }
        if (!redirectUriPolicy.isAllowed(request.redirectUri())) {
            return reject("redirect_uri", "redirect_uri is not an allowed redirect target");
        }
        return Optional.empty();
    }

    private void storeChallenge(AuthorizeRequest request) {
        Instant now = Instant.now();

        PkceChallenge challenge = new PkceChallenge();
        challenge.outerState = request.state();
        challenge.codeChallenge = request.codeChallenge();
        challenge.method = ChallengeMethod.fromParameter(request.codeChallengeMethod()).orElseThrow();
        challenge.redirectUri = request.redirectUri();
        challenge.clientId = request.clientId();
        challenge.createdAt = now;
        challenge.expiresAt = now.plus(config.pkce().challengeTtl());
        challengeStore.store(challenge);
    }

    private AuthorizeOutcome redirectToProvider(String outerState, String sessionId) {
        String innerState = stateBridge.issue(outerState, sessionId);
        URI location = URI.create(provider.authorizationUrl(innerState));
        LOG.infof("Session %s redirected to third-party consent", sessionId);
        return new AuthorizeOutcome.RedirectToProvider(location, sessionId, innerState);
    }

    private static Optional<AuthorizeOutcome.Rejected> reject(String field, String description) {
        return Optional.of(AuthorizeOutcome.Rejected.invalidRequest(field, description));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
