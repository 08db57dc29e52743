package tech.ledgerbridge.broker.pkce;

import java.util.Optional;

/**
 * PKCE code challenge methods accepted from the outer client.
 */
public enum ChallengeMethod {
    S256("S256"),
    PLAIN("plain");

    private final String parameterValue;

    ChallengeMethod(String parameterValue) {
        this.parameterValue = parameterValue;
    }

    public String parameterValue() {
        return parameterValue;
    }

    /**
     * Parse the code_challenge_method request parameter. Matching is exact.
     */
    public static Optional<ChallengeMethod> fromParameter(String value) {
        for (ChallengeMethod method : values()) {
            if (method.parameterValue.equals(value)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
