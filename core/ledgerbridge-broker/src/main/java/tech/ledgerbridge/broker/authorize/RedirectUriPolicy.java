package tech.ledgerbridge.broker.authorize;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.ledgerbridge.broker.BrokerConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Decides whether the broker may redirect an authorization result to a URI.
 *
 * <p>The URI is parsed and its host compared exactly against the allow-list, so
 * {@code https://claude.ai.evil.example} or {@code https://evil.example/claude.ai}
 * are rejected.
 */
@ApplicationScoped
public class RedirectUriPolicy {

    @Inject
    BrokerConfig config;

    public boolean isAllowed(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()) {
            return false;
        }

        URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            return false;
        }

        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (scheme == null || host == null || uri.getRawUserInfo() != null || uri.getRawFragment() != null) {
            return false;
        }
        if (!"https".equalsIgnoreCase(scheme) && !"http".equalsIgnoreCase(scheme)) {
            return false;
        }

        String normalizedHost = host.toLowerCase(Locale.ROOT);
        return config.allowedRedirectHosts().stream()
            .map(h -> h.trim().toLowerCase(Locale.ROOT))
            .anyMatch(normalizedHost::equals);
    }
}
