package tech.ledgerbridge.broker;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for the LedgerBridge OAuth broker.
 *
 * Example configuration:
 * <pre>
 * ledgerbridge.broker.allowed-redirect-hosts=claude.ai,localhost,127.0.0.1
 * ledgerbridge.broker.storage.type=database
 * ledgerbridge.broker.provider.client-id=ABxyz...
 * ledgerbridge.broker.provider.client-secret=...
 * ledgerbridge.broker.provider.redirect-uri=https://broker.example.com/oauth/callback
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "ledgerbridge.broker")
public interface BrokerConfig {

    /**
     * Hostnames the outer client may redirect back to.
     * Compared against the parsed host of redirect_uri, never as a prefix.
     */
    @WithName("allowed-redirect-hosts")
    @WithDefault("claude.ai,localhost,127.0.0.1")
    List<String> allowedRedirectHosts();

    /**
     * Single-company deployments only: the tenant every /authorize request is assumed
     * to connect. When set, a connected tenant is shared without asking the provider.
     * Unset by default.
     */
    @WithName("default-tenant-id")
    Optional<String> defaultTenantId();

    PkceConfig pkce();

    CodeConfig code();

    StateConfig state();

    SessionConfig session();

    TokenConfig token();

    LockConfig lock();

    StorageConfig storage();

    ProviderConfig provider();

    interface PkceConfig {
        /**
         * How long a stored code challenge waits for its token exchange.
         */
        @WithName("challenge-ttl")
        @WithDefault("PT10M")
        Duration challengeTtl();
    }

    interface CodeConfig {
        @WithDefault("PT10M")
        Duration ttl();

        /**
         * How long a consumed code is kept so replays are recognised as replays.
         */
        @WithName("used-retention")
        @WithDefault("PT5M")
        Duration usedRetention();
    }

    interface StateConfig {
        @WithDefault("PT10M")
        Duration ttl();
    }

    interface SessionConfig {
        /**
         * Minimum remaining provider token lifetime for a tenant session to be shared
         * with a new outer-client session.
         */
        @WithName("shared-safety-margin")
        @WithDefault("PT30M")
        Duration sharedSafetyMargin();

        /**
         * Provider tokens closer than this to expiry are refreshed before use.
         */
        @WithName("refresh-threshold")
        @WithDefault("PT5M")
        Duration refreshThreshold();
    }

    interface TokenConfig {
        @WithName("access-token-ttl")
        @WithDefault("PT1H")
        Duration accessTokenTtl();

        @WithName("refresh-token-ttl")
        @WithDefault("P7D")
        Duration refreshTokenTtl();

        /**
         * Whether broker tokens carry a refresh token and /token/refresh is served.
         */
        @WithName("refresh-tokens-enabled")
        @WithDefault("true")
        boolean refreshTokensEnabled();
    }

    interface LockConfig {
        /**
         * Maximum time a caller waits for a tenant lock.
         */
        @WithName("wait-timeout")
        @WithDefault("PT30S")
        Duration waitTimeout();
    }

    interface StorageConfig {
        /**
         * Backend for company sessions and broker tokens.
         */
        @WithDefault("DATABASE")
        StorageType type();

        @WithName("retry-attempts")
        @WithDefault("3")
        int retryAttempts();

        /**
         * Backoff step; attempt n waits n times this value.
         */
        @WithName("retry-backoff")
        @WithDefault("PT0.2S")
        Duration retryBackoff();
    }

    interface ProviderConfig {
        @WithName("authorization-endpoint")
        @WithDefault("https://appcenter.intuit.com/connect/oauth2")
        String authorizationEndpoint();

        @WithName("token-endpoint")
        @WithDefault("https://oauth.platform.intuit.com/oauth2/v1/tokens/bearer")
        String tokenEndpoint();

        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        /**
         * Callback registered with the provider; must point at /oauth/callback.
         */
        @WithName("redirect-uri")
        Optional<String> redirectUri();

        @WithDefault("com.intuit.quickbooks.accounting")
        String scope();

        @WithName("request-timeout")
        @WithDefault("PT30S")
        Duration requestTimeout();
    }

    enum StorageType {
        MEMORY,
        DATABASE
    }
}
