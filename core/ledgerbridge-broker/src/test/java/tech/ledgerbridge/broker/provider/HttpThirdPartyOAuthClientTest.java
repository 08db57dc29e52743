package tech.ledgerbridge.broker.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.ledgerbridge.broker.TestBrokerConfig;

import java.net.URI;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class HttpThirdPartyOAuthClientTest {

    // ========================================
    // parseTokenResponse TESTS
    // ========================================

    @Test
    @DisplayName("parseTokenResponse should read tokens and lifetime from a 200 response")
    void parseTokenResponse_shouldReadTokens_whenOk() throws Exception {
        ProviderTokens tokens = HttpThirdPartyOAuthClient.parseTokenResponse(200,
            "{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"expires_in\":3600,\"token_type\":\"bearer\"}");

        assertThat(tokens.accessToken()).isEqualTo("at");
        assertThat(tokens.refreshToken()).isEqualTo("rt");
        assertThat(tokens.expiresInSeconds()).isEqualTo(3600);

        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        assertThat(tokens.expiresAt(now)).isEqualTo(now.plusSeconds(3600));
    }

    @Test
    @DisplayName("parseTokenResponse should surface the provider's OAuth error")
    void parseTokenResponse_shouldThrowAuthException_whenProviderRejects() {
        assertThatThrownBy(() -> HttpThirdPartyOAuthClient.parseTokenResponse(400,
                "{\"error\":\"invalid_grant\",\"error_description\":\"Token invalid\"}"))
            .isInstanceOf(ThirdPartyAuthException.class)
            .isNotInstanceOf(ThirdPartyUnavailableException.class)
            .hasMessage("Token invalid")
            .extracting(e -> ((ThirdPartyAuthException) e).getError())
            .isEqualTo("invalid_grant");
    }

    @Test
    @DisplayName("parseTokenResponse should mark 5xx responses as unavailability")
    void parseTokenResponse_shouldThrowUnavailable_whenServerError() {
        assertThatThrownBy(() -> HttpThirdPartyOAuthClient.parseTokenResponse(503, "busy"))
            .isInstanceOf(ThirdPartyUnavailableException.class);
    }

    @Test
    @DisplayName("parseTokenResponse should reject responses without tokens or lifetime")
    void parseTokenResponse_shouldReject_whenFieldsMissing() {
        assertThatThrownBy(() -> HttpThirdPartyOAuthClient.parseTokenResponse(200, "{\"access_token\":\"at\"}"))
            .isInstanceOf(ThirdPartyAuthException.class)
            .extracting(e -> ((ThirdPartyAuthException) e).getError())
            .isEqualTo("invalid_response");

        assertThatThrownBy(() -> HttpThirdPartyOAuthClient.parseTokenResponse(200,
                "{\"access_token\":\"at\",\"refresh_token\":\"rt\"}"))
            .isInstanceOf(ThirdPartyAuthException.class);

        assertThatThrownBy(() -> HttpThirdPartyOAuthClient.parseTokenResponse(200, "<html>"))
            .isInstanceOf(ThirdPartyAuthException.class);
    }

    // ========================================
    // authorizationUrl TESTS
    // ========================================

    @Test
    @DisplayName("authorizationUrl should carry client, callback, scope and inner state")
    void authorizationUrl_shouldIncludeParameters() {
        HttpThirdPartyOAuthClient client = new HttpThirdPartyOAuthClient();
        client.config = new TestBrokerConfig();

        URI url = URI.create(client.authorizationUrl("inner-state_123"));

        assertThat(url.getHost()).isEqualTo("provider.example");
        assertThat(url.getQuery())
            .contains("client_id=provider-client")
            .contains("redirect_uri=https://broker.example/oauth/callback")
            .contains("scope=com.intuit.quickbooks.accounting")
            .contains("response_type=code")
            .contains("state=inner-state_123");
    }

    @Test
    @DisplayName("authorizationUrl should fail when the provider client is not configured")
    void authorizationUrl_shouldThrow_whenClientIdMissing() {
        TestBrokerConfig config = new TestBrokerConfig();
        config.providerClientId = null;
        HttpThirdPartyOAuthClient client = new HttpThirdPartyOAuthClient();
        client.config = config;

        assertThatThrownBy(() -> client.authorizationUrl("state"))
            .isInstanceOf(ProviderNotConfiguredException.class);
    }
}
