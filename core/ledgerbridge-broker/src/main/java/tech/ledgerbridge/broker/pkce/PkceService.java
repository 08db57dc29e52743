package tech.ledgerbridge.broker.pkce;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange) verification for the outer client leg.
 *
 * Flow:
 * 1. Outer client generates a random code_verifier
 * 2. Outer client sends code_challenge = BASE64URL(SHA256(code_verifier)) to /authorize
 * 3. Broker stores the challenge keyed by the client's state
 * 4. Outer client sends code_verifier to /token
 * 5. Broker recomputes the challenge and compares in constant time
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    private static final Pattern VERIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");

    /**
     * Compute the S256 challenge for a verifier.
     *
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier)))
     */
    public String computeS256Challenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify that a code verifier matches the stored challenge under the stored method.
     *
     * @param method Method recorded at /authorize
     * @param codeVerifier The verifier provided in the token request
     * @param codeChallenge The challenge recorded at /authorize
     * @return true if the verifier matches the challenge
     */
    public boolean verify(ChallengeMethod method, String codeVerifier, String codeChallenge) {
        if (method == null || codeVerifier == null || codeChallenge == null) {
            return false;
        }

        return switch (method) {
            case S256 -> constantTimeEquals(computeS256Challenge(codeVerifier), codeChallenge);
            case PLAIN -> constantTimeEquals(codeVerifier, codeChallenge);
        };
    }

    /**
     * Per RFC 7636: 43-128 characters from the unreserved set [A-Za-z0-9-._~].
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        return codeVerifier != null && VERIFIER_PATTERN.matcher(codeVerifier).matches();
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(
            a.getBytes(StandardCharsets.US_ASCII),
            b.getBytes(StandardCharsets.US_ASCII));
    }
}
