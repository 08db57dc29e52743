package tech.ledgerbridge.broker.authorize;

/**
 * Query parameters of an outer-client authorization request.
 *
 * <p>Carries no tenant; the company is learned from the provider callback.
 */
public record AuthorizeRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String codeChallenge,
    String codeChallengeMethod,
    String state,
    String scope
) {
}
