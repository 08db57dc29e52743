package tech.ledgerbridge.broker.integration;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import tech.ledgerbridge.broker.provider.ProviderTokens;
import tech.ledgerbridge.broker.provider.ThirdPartyAuthException;
import tech.ledgerbridge.broker.provider.ThirdPartyOAuthClient;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accounting provider stand-in for the Quarkus test profile.
 * Codes starting with {@code bad-} are refused.
 */
@Mock
@ApplicationScoped
public class FakeThirdPartyOAuthClient implements ThirdPartyOAuthClient {

    static final String CONSENT_URL = "https://provider.example/consent";

    private final AtomicInteger exchanges = new AtomicInteger();

    @Override
    public String authorizationUrl(String innerState) {
        return CONSENT_URL + "?state=" + innerState;
    }

    @Override
    public ProviderTokens exchangeCode(String code) throws ThirdPartyAuthException {
        if (code.startsWith("bad-")) {
            throw new ThirdPartyAuthException("invalid_grant", "code rejected");
        }
        int n = exchanges.incrementAndGet();
        return new ProviderTokens("provider-access-" + n, "provider-refresh-" + n, 3600);
    }

    @Override
    public ProviderTokens refresh(String refreshToken) {
        int n = exchanges.incrementAndGet();
        return new ProviderTokens("provider-access-" + n, "provider-refresh-" + n, 3600);
    }

    int exchangeCount() {
        return exchanges.get();
    }
}
