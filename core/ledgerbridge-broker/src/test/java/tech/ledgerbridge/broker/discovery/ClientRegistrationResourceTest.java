package tech.ledgerbridge.broker.discovery;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClientRegistrationResourceTest {

    private final ClientRegistrationResource resource = new ClientRegistrationResource();

    @Test
    @DisplayName("register should fill in defaults for an empty request")
    void register_shouldApplyDefaults_whenRequestEmpty() {
        Response response = resource.register(null);

        assertThat(response.getStatus()).isEqualTo(201);
        ClientRegistrationResource.RegistrationResponse body =
            (ClientRegistrationResource.RegistrationResponse) response.getEntity();
        assertThat(body.client_id()).matches("[0-9a-f]{64}");
        assertThat(body.client_secret()).matches("[0-9a-f]{96}");
        assertThat(body.client_name()).isEqualTo("MCP Client");
        assertThat(body.redirect_uris()).containsExactly("https://claude.ai/api/mcp/auth_callback");
        assertThat(body.token_endpoint_auth_method()).isEqualTo("none");
    }

    @Test
    @DisplayName("register should echo the client's own metadata")
    void register_shouldKeepClientMetadata() {
        ClientRegistrationResource.RegistrationRequest request = new ClientRegistrationResource.RegistrationRequest(
            "Desk App", List.of("http://localhost:3000/cb"), List.of("code"), List.of("authorization_code"));

        ClientRegistrationResource.RegistrationResponse body =
            (ClientRegistrationResource.RegistrationResponse) resource.register(request).getEntity();

        assertThat(body.client_name()).isEqualTo("Desk App");
        assertThat(body.redirect_uris()).containsExactly("http://localhost:3000/cb");
        assertThat(body.grant_types()).containsExactly("authorization_code");
    }

    @Test
    @DisplayName("register should issue distinct credentials per call")
    void register_shouldIssueDistinctClientIds() {
        var first = (ClientRegistrationResource.RegistrationResponse) resource.register(null).getEntity();
        var second = (ClientRegistrationResource.RegistrationResponse) resource.register(null).getEntity();

        assertThat(first.client_id()).isNotEqualTo(second.client_id());
    }
}
