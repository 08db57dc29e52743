package tech.ledgerbridge.broker.discovery;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.ledgerbridge.broker.BrokerConfig;

import java.util.List;

/**
 * OAuth 2.0 Authorization Server Metadata, so outer clients can discover the broker's endpoints.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8414">RFC 8414</a>
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "OAuth2 discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class AuthorizationServerMetadataResource {

    @Inject
    BrokerConfig config;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/oauth-authorization-server")
    @Operation(summary = "Get authorization server metadata")
    @APIResponse(responseCode = "200", description = "Authorization server metadata")
    public AuthorizationServerMetadata metadata() {
        String baseUrl = getBaseUrl();
        List<String> grantTypes = config.token().refreshTokensEnabled()
            ? List.of("authorization_code", "refresh_token")
            : List.of("authorization_code");

        return new AuthorizationServerMetadata(
            baseUrl,
            baseUrl + "/authorize",
            baseUrl + "/token",
            baseUrl + "/register",
            List.of("none"),
            List.of("code"),
            grantTypes,
            List.of("S256", "plain")
        );
    }

    private String getBaseUrl() {
        return uriInfo.getBaseUri().toString().replaceAll("/$", "");
    }

    public record AuthorizationServerMetadata(
        String issuer,
        String authorization_endpoint,
        String token_endpoint,
        String registration_endpoint,
        List<String> token_endpoint_auth_methods_supported,
        List<String> response_types_supported,
        List<String> grant_types_supported,
        List<String> code_challenge_methods_supported
    ) {}
}
