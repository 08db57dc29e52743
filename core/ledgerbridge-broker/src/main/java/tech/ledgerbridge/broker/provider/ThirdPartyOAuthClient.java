package tech.ledgerbridge.broker.provider;

/**
 * The broker's side of the third-party OAuth leg.
 */
public interface ThirdPartyOAuthClient {

    /**
     * URL of the third party's consent page carrying the given inner state.
     *
     * @throws ProviderNotConfiguredException if client id or redirect uri are missing
     */
    String authorizationUrl(String innerState);

    /**
     * Exchange the code from the third-party callback for tokens.
     */
    ProviderTokens exchangeCode(String code) throws ThirdPartyAuthException;

    /**
     * Trade a refresh token for new tokens. Third-party refresh tokens rotate, so the
     * returned refresh token replaces the one passed in.
     */
    ProviderTokens refresh(String refreshToken) throws ThirdPartyAuthException;
}
