package tech.ledgerbridge.broker.discovery;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.shared.TokenGenerator;

import java.util.List;

/**
 * Dynamic client registration.
 *
 * Registrations are not stored: the broker authenticates outer clients by PKCE alone,
 * so the issued client_id only has to match between /authorize and /token.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7591">RFC 7591</a>
 */
@Path("/register")
@Tag(name = "Discovery", description = "OAuth2 discovery endpoints")
public class ClientRegistrationResource {

    private static final Logger LOG = Logger.getLogger(ClientRegistrationResource.class);

    static final String DEFAULT_CLIENT_NAME = "MCP Client";
    static final String DEFAULT_REDIRECT_URI = "https://claude.ai/api/mcp/auth_callback";

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Register an outer client")
    public Response register(RegistrationRequest request) {
        RegistrationRequest body = request != null ? request : new RegistrationRequest(null, null, null, null);

        String clientId = TokenGenerator.randomHex(32);
        String clientSecret = TokenGenerator.randomHex(48);

        RegistrationResponse response = new RegistrationResponse(
            clientId,
            clientSecret,
            body.client_name() != null ? body.client_name() : DEFAULT_CLIENT_NAME,
            body.redirect_uris() != null ? body.redirect_uris() : List.of(DEFAULT_REDIRECT_URI),
            body.response_types() != null ? body.response_types() : List.of("code"),
            body.grant_types() != null ? body.grant_types() : List.of("authorization_code", "refresh_token"),
            "none"
        );

        LOG.infof("Registered client %s (%s)", TokenGenerator.preview(clientId), response.client_name());
        return Response.status(Response.Status.CREATED).entity(response).build();
    }

    // ==================== DTOs ====================

    public record RegistrationRequest(
        String client_name,
        List<String> redirect_uris,
        List<String> response_types,
        List<String> grant_types
    ) {}

    public record RegistrationResponse(
        String client_id,
        String client_secret,
        String client_name,
        List<String> redirect_uris,
        List<String> response_types,
        List<String> grant_types,
        String token_endpoint_auth_method
    ) {}
}
