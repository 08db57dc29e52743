package tech.ledgerbridge.broker.callback;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.code.AuthorizationCode;
import tech.ledgerbridge.broker.code.AuthorizationCodeService;
import tech.ledgerbridge.broker.lock.LockTimeoutException;
import tech.ledgerbridge.broker.lock.TenantLock;
import tech.ledgerbridge.broker.pkce.ChallengeStore;
import tech.ledgerbridge.broker.pkce.PkceChallenge;
import tech.ledgerbridge.broker.provider.ProviderTokens;
import tech.ledgerbridge.broker.provider.ThirdPartyAuthException;
import tech.ledgerbridge.broker.provider.ThirdPartyUnavailableException;
import tech.ledgerbridge.broker.provider.ThirdPartyOAuthClient;
import tech.ledgerbridge.broker.session.CompanySession;
import tech.ledgerbridge.broker.session.CompanySessionService;
import tech.ledgerbridge.broker.shared.RedirectUris;
import tech.ledgerbridge.broker.state.StateBridge;
import tech.ledgerbridge.broker.state.StateBridgeEntry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Completes the third-party leg and hands the outer client its authorization code.
 *
 * <p>Under the tenant lock, a tenant that is already connected with tokens valid
 * beyond the shared-session margin is reused without exchanging the third-party
 * code. Of two users consenting for the same new company at the same time, only
 * the first exchanges a code; the second joins the first's connection.
 */
@ApplicationScoped
public class ThirdPartyCallbackHandler {

    private static final Logger LOG = Logger.getLogger(ThirdPartyCallbackHandler.class);

    @Inject
    StateBridge stateBridge;

    @Inject
    ChallengeStore challengeStore;

    @Inject
    CompanySessionService companySessions;

    @Inject
    AuthorizationCodeService authorizationCodes;

    @Inject
    ThirdPartyOAuthClient provider;

    @Inject
    TenantLock tenantLock;

    @Inject
    BrokerConfig config;

    public CallbackOutcome handle(String code, String tenantId, String innerState,
                                  String error, String errorDescription) {
        if (error != null) {
            LOG.warnf("Third party returned error: %s (%s)", error, errorDescription);
            String detail = errorDescription != null ? errorDescription : error;
            return new CallbackOutcome.Failed(Response.Status.BAD_REQUEST,
                "Authorization Failed", "The accounting provider reported: " + detail);
        }

        if (isBlank(code) || isBlank(tenantId) || isBlank(innerState)) {
            LOG.warnf("Callback missing parameters: code=%s, realmId=%s, state=%s",
                present(code), present(tenantId), present(innerState));
            return new CallbackOutcome.Failed(Response.Status.BAD_REQUEST,
                "Authorization Failed", "Missing required parameters (code, realmId, or state).");
        }

        Optional<StateBridgeEntry> bridged = stateBridge.redeem(innerState);
        if (bridged.isEmpty()) {
            return new CallbackOutcome.Failed(Response.Status.BAD_REQUEST,
                "Invalid OAuth State", "Could not verify the OAuth state. Please restart the authorization process.");
        }

        StateBridgeEntry entry = bridged.get();
        Optional<PkceChallenge> challenge = challengeStore.find(entry.outerState);
        if (challenge.isEmpty()) {
            LOG.warnf("Authorization request for session %s expired before the callback", entry.sessionId);
            return new CallbackOutcome.Failed(Response.Status.BAD_REQUEST,
                "Authorization Expired", "The authorization request has expired. Please restart the authorization process.");
        }

        boolean shared;
        try (TenantLock.LockHandle ignored = tenantLock.acquire(tenantId, config.lock().waitTimeout())) {
            Optional<CompanySession> existing = companySessions.findShareable(tenantId);
            if (existing.isPresent()) {
                companySessions.share(existing.get(), entry.sessionId);
                shared = true;
            } else {
                ProviderTokens tokens;
                try {
                    tokens = provider.exchangeCode(code);
                } catch (ThirdPartyUnavailableException | CircuitBreakerOpenException e) {
                    LOG.warnf("Third party unavailable during code exchange for tenant %s: %s", tenantId, e.getMessage());
                    return CallbackOutcome.Failed.unavailable();
                } catch (ThirdPartyAuthException e) {
                    LOG.errorf("Third-party code exchange failed for tenant %s: %s (%s)", tenantId, e.getMessage(), e.getError());
                    return new CallbackOutcome.Failed(Response.Status.BAD_GATEWAY,
                        "Token Exchange Failed", "Could not obtain tokens from the accounting provider. Please try again.");
                }
                companySessions.connect(entry.sessionId, tenantId, tokens);
                shared = false;
            }
        } catch (LockTimeoutException e) {
            LOG.warnf("Tenant lock for %s not obtained; callback for session %s abandoned", tenantId, entry.sessionId);
            return CallbackOutcome.Failed.unavailable();
        }

        AuthorizationCode authorizationCode = authorizationCodes.mint(entry.sessionId, entry.outerState);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", authorizationCode.code);
        params.put("state", entry.outerState);

        LOG.infof("Callback complete for tenant %s, session %s (%s)", tenantId, entry.sessionId, shared ? "shared" : "new connection");
        return new CallbackOutcome.Completed(
            RedirectUris.withQuery(challenge.get().redirectUri, params), entry.sessionId, tenantId, shared);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String present(String value) {
        return isBlank(value) ? "missing" : "present";
    }
}
