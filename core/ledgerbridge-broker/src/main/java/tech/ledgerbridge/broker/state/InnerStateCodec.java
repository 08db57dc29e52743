package tech.ledgerbridge.broker.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes {@link InnerState} as base64url JSON.
 *
 * <p>The token is opaque to callers. The {@code v} field is read before the rest
 * of the payload so a future schema can be introduced without breaking tokens
 * that are still in flight.
 */
@ApplicationScoped
public class InnerStateCodec {

    public static final int CURRENT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public String encode(InnerState state) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(state);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode inner state", e);
        }
    }

    /**
     * @throws InvalidInnerStateException if the token is not base64url JSON, has an
     *         unsupported version or lacks a required field
     */
    public InnerState decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidInnerStateException("Inner state is empty");
        }

        JsonNode json;
        try {
            byte[] bytes = Base64.getUrlDecoder().decode(token);
            json = MAPPER.readTree(new String(bytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new InvalidInnerStateException("Inner state is not valid base64url JSON", e);
        }

        if (json == null || !json.isObject()) {
            throw new InvalidInnerStateException("Inner state is not a JSON object");
        }

        int version = json.path("v").asInt(-1);
        if (version != CURRENT_VERSION) {
            throw new InvalidInnerStateException("Unsupported inner state version: " + version);
        }

        String outerState = json.path("outerState").asText(null);
        String sessionId = json.path("sessionId").asText(null);
        if (outerState == null || sessionId == null) {
            throw new InvalidInnerStateException("Inner state is missing outerState or sessionId");
        }

        return new InnerState(
            version,
            outerState,
            sessionId,
            json.path("nonce").asText(null),
            json.path("issuedAt").asLong(0L)
        );
    }
}
