package tech.ledgerbridge.broker.shared;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Random identifiers used across both OAuth legs.
 */
public final class TokenGenerator {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final String BROKER_TOKEN_PREFIX = "mcp_";

    private TokenGenerator() {
    }

    /**
     * Broker bearer token: {@code mcp_} followed by 64 hex characters.
     */
    public static String brokerToken() {
        return BROKER_TOKEN_PREFIX + randomHex(32);
    }

    /**
     * Authorization code and broker refresh token: 64 hex characters.
     */
    public static String authorizationCode() {
        return randomHex(32);
    }

    public static String sessionId() {
        return UUID.randomUUID().toString();
    }

    public static String nonce() {
        byte[] bytes = new byte[16];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public static String randomHex(int byteCount) {
        byte[] bytes = new byte[byteCount];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Shortens a secret for log output.
     */
    public static String preview(String secret) {
        if (secret == null) {
            return "null";
        }
        return secret.length() > 12 ? secret.substring(0, 12) + "..." : secret;
    }
}
