package tech.ledgerbridge.broker.authorize;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.lock.LockTimeoutException;
import tech.ledgerbridge.broker.provider.ProviderNotConfiguredException;
import tech.ledgerbridge.broker.shared.HtmlPages;
import tech.ledgerbridge.broker.shared.StorageUnavailableException;

/**
 * Outer-client authorization endpoint.
 *
 * GET /authorize?
 *   response_type=code
 *   &client_id=abc
 *   &redirect_uri=https://claude.ai/api/mcp/auth_callback
 *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
 *   &code_challenge_method=S256
 *   &state=xyz123
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-4.1.1">RFC 6749 §4.1.1</a>
 */
@Path("/authorize")
@Tag(name = "OAuth2 Authorization", description = "Outer-client authorization code flow")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);

    @Inject
    AuthorizationOrchestrator orchestrator;

    @GET
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Start authorization code flow with PKCE")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "Outer client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "URI to redirect after authorization")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method (S256 or plain)")
            @QueryParam("code_challenge_method") String codeChallengeMethod,

            @Parameter(description = "Client state for CSRF protection")
            @QueryParam("state") String state,

            @Parameter(description = "Requested scope")
            @QueryParam("scope") String scope
    ) {
        LOG.infof("Authorization request: client_id=%s, redirect_uri=%s, method=%s, scope=%s",
            clientId, redirectUri, codeChallengeMethod, scope);

        AuthorizeRequest request = new AuthorizeRequest(
            responseType, clientId, redirectUri, codeChallenge, codeChallengeMethod, state, scope);

        AuthorizeOutcome outcome;
        try {
            outcome = orchestrator.authorize(request);
        } catch (ProviderNotConfiguredException e) {
            LOG.error(e.getMessage());
            return HtmlPages.error(Response.Status.INTERNAL_SERVER_ERROR,
                "Server Configuration Error",
                "The accounting connection is not configured. Please contact the administrator.");
        } catch (LockTimeoutException | StorageUnavailableException e) {
            LOG.warnf("Authorization request could not be served right now: %s", e.getMessage());
            return HtmlPages.error(Response.Status.SERVICE_UNAVAILABLE,
                "Temporarily Unavailable",
                "The server is busy. Please try again in a moment.");
        }

        if (outcome instanceof AuthorizeOutcome.RedirectToClient toClient) {
            return Response.seeOther(toClient.location()).build();
        }
        if (outcome instanceof AuthorizeOutcome.RedirectToProvider toProvider) {
            return Response.seeOther(toProvider.location()).build();
        }

        AuthorizeOutcome.Rejected rejected = (AuthorizeOutcome.Rejected) outcome;
        return HtmlPages.error(Response.Status.BAD_REQUEST,
            "Invalid Authorization Request",
            rejected.description(),
            "Please check the request parameters and try again.");
    }
}
