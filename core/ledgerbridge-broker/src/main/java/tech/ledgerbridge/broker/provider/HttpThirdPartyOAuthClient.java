package tech.ledgerbridge.broker.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.faulttolerance.api.CircuitBreakerName;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;
import tech.ledgerbridge.broker.shared.TokenGenerator;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Third-party OAuth client over {@link HttpClient}.
 *
 * <p>Token requests are form posts authenticated with HTTP Basic client credentials.
 * Repeated transport failures open a circuit so a provider outage does not tie up
 * tenant locks for the full request timeout on every call.
 */
@ApplicationScoped
public class HttpThirdPartyOAuthClient implements ThirdPartyOAuthClient {

    private static final Logger LOG = Logger.getLogger(HttpThirdPartyOAuthClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    BrokerConfig config;

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();

    @Override
    public String authorizationUrl(String innerState) {
        BrokerConfig.ProviderConfig provider = config.provider();
        String clientId = provider.clientId().orElseThrow(() -> new ProviderNotConfiguredException("client-id"));
        String redirectUri = provider.redirectUri().orElseThrow(() -> new ProviderNotConfiguredException("redirect-uri"));

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", clientId);
        params.put("redirect_uri", redirectUri);
        params.put("scope", provider.scope());
        params.put("response_type", "code");
        params.put("state", innerState);

        String endpoint = provider.authorizationEndpoint();
        return endpoint + (endpoint.contains("?") ? "&" : "?") + formEncode(params);
    }

    @Override
    @CircuitBreaker(
        requestVolumeThreshold = 10,
        failureRatio = 0.5,
        delay = 5000,
        successThreshold = 3,
        failOn = ThirdPartyUnavailableException.class
    )
    @CircuitBreakerName("third-party-token-endpoint")
    public ProviderTokens exchangeCode(String code) throws ThirdPartyAuthException {
        String redirectUri = config.provider().redirectUri()
            .orElseThrow(() -> new ProviderNotConfiguredException("redirect-uri"));

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", redirectUri);

        LOG.debugf("Exchanging third-party code %s", TokenGenerator.preview(code));
        return postTokenRequest(form);
    }

    @Override
    @CircuitBreaker(
        requestVolumeThreshold = 10,
        failureRatio = 0.5,
        delay = 5000,
        successThreshold = 3,
        failOn = ThirdPartyUnavailableException.class
    )
    @CircuitBreakerName("third-party-token-endpoint")
    public ProviderTokens refresh(String refreshToken) throws ThirdPartyAuthException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);

        LOG.debugf("Refreshing third-party token %s", TokenGenerator.preview(refreshToken));
        return postTokenRequest(form);
    }

    private ProviderTokens postTokenRequest(Map<String, String> form) throws ThirdPartyAuthException {
        BrokerConfig.ProviderConfig provider = config.provider();
        String clientId = provider.clientId().orElseThrow(() -> new ProviderNotConfiguredException("client-id"));
        String clientSecret = provider.clientSecret().orElseThrow(() -> new ProviderNotConfiguredException("client-secret"));
        String credentials = Base64.getEncoder()
            .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(provider.tokenEndpoint()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .header("Authorization", "Basic " + credentials)
            .timeout(provider.requestTimeout())
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ThirdPartyUnavailableException("Token endpoint unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThirdPartyUnavailableException("Interrupted while calling token endpoint", e);
        }

        return parseTokenResponse(response.statusCode(), response.body());
    }

    static ProviderTokens parseTokenResponse(int status, String body) throws ThirdPartyAuthException {
        if (status >= 500) {
            LOG.errorf("Token endpoint returned %d", status);
            throw new ThirdPartyUnavailableException("Token endpoint returned " + status);
        }

        JsonNode json;
        try {
            json = MAPPER.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new ThirdPartyAuthException("invalid_response", "Token endpoint returned malformed JSON", e);
        }

        if (status != 200) {
            String error = json == null ? null : json.path("error").asText(null);
            String description = json == null ? null : json.path("error_description").asText(null);
            LOG.warnf("Token endpoint returned %d: error=%s, description=%s", status, error, description);
            throw new ThirdPartyAuthException(
                error != null ? error : "http_" + status,
                description != null ? description : "Token endpoint returned " + status);
        }

        String accessToken = json == null ? null : json.path("access_token").asText(null);
        String refreshToken = json == null ? null : json.path("refresh_token").asText(null);
        long expiresIn = json == null ? 0 : json.path("expires_in").asLong(0);

        if (accessToken == null || refreshToken == null) {
            throw new ThirdPartyAuthException("invalid_response", "Token response is missing access_token or refresh_token");
        }
        if (expiresIn <= 0) {
            throw new ThirdPartyAuthException("invalid_response", "Token response is missing expires_in");
        }

        return new ProviderTokens(accessToken, refreshToken, expiresIn);
    }

    private static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
