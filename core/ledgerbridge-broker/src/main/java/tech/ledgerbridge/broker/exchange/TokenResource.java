package tech.ledgerbridge.broker.exchange;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.token.BrokerToken;

import java.time.Duration;
import java.util.Map;

/**
 * Outer-client token endpoint.
 *
 * Supported grant types:
 * - authorization_code: code + PKCE code_verifier
 * - refresh_token: broker refresh token rotation (when enabled)
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-4.1.3">RFC 6749 §4.1.3</a>
 */
@Path("/token")
@Tag(name = "OAuth2 Authorization", description = "Outer-client authorization code flow")
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    private static final Logger LOG = Logger.getLogger(TokenResource.class);

    @Inject
    TokenExchangeOrchestrator orchestrator;

    @Inject
    BrokerConfig config;

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Exchange an authorization code for a broker token")
    public Response token(
            @Parameter(description = "authorization_code or refresh_token")
            @FormParam("grant_type") String grantType,

            @Parameter(description = "Authorization code from /oauth/callback")
            @FormParam("code") String code,

            @Parameter(description = "PKCE code verifier")
            @FormParam("code_verifier") String codeVerifier,

            @Parameter(description = "Client ID used on /authorize")
            @FormParam("client_id") String clientId,

            @Parameter(description = "Redirect URI (must match authorization request when given)")
            @FormParam("redirect_uri") String redirectUri,

            @Parameter(description = "Broker refresh token (for refresh_token grant)")
            @FormParam("refresh_token") String refreshToken
    ) {
        if ("authorization_code".equals(grantType)) {
            LOG.infof("Token request: client_id=%s", clientId);
            return respond(orchestrator.exchangeCode(code, codeVerifier, clientId, redirectUri));
        }
        if ("refresh_token".equals(grantType) && config.token().refreshTokensEnabled()) {
            return respond(orchestrator.refresh(refreshToken, Response.Status.BAD_REQUEST));
        }
        return tokenError(Response.Status.BAD_REQUEST, "unsupported_grant_type",
            "Grant type not supported: " + grantType);
    }

    @POST
    @Path("/refresh")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Rotate a broker refresh token")
    public Response refreshForm(@FormParam("refresh_token") String refreshToken) {
        return refresh(refreshToken);
    }

    @POST
    @Path("/refresh")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Rotate a broker refresh token")
    public Response refreshJson(RefreshRequest request) {
        return refresh(request != null ? request.refresh_token() : null);
    }

    private Response refresh(String refreshToken) {
        if (!config.token().refreshTokensEnabled()) {
            return tokenError(Response.Status.NOT_FOUND, "unsupported_grant_type", "Token refresh is disabled");
        }
        return respond(orchestrator.refresh(refreshToken, Response.Status.UNAUTHORIZED));
    }

    private Response respond(ExchangeOutcome outcome) {
        if (outcome instanceof ExchangeOutcome.Issued issued) {
            BrokerToken token = issued.token();
            long expiresIn = Duration.between(token.issuedAt, token.expiresAt).getSeconds();
            return Response.ok(new TokenResponse(token.token, "Bearer", expiresIn, token.refreshToken))
                .header("Cache-Control", "no-store")
                .build();
        }

        ExchangeOutcome.Failed failed = (ExchangeOutcome.Failed) outcome;
        return tokenError(failed.status(), failed.error(), failed.description());
    }

    private Response tokenError(Response.Status status, String error, String description) {
        return Response.status(status)
            .entity(Map.of("error", error, "error_description", description))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }

    // ==================== DTOs ====================

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TokenResponse(
        String access_token,
        String token_type,
        long expires_in,
        String refresh_token
    ) {}

    public record RefreshRequest(String refresh_token) {}
}
