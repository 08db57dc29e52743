package tech.ledgerbridge.broker;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Mutable {@link BrokerConfig} for unit tests, pre-filled with the production defaults.
 */
public class TestBrokerConfig implements BrokerConfig {

    public List<String> allowedRedirectHosts = List.of("claude.ai", "localhost", "127.0.0.1", "outer.example");
    public String defaultTenantId;

    public Duration challengeTtl = Duration.ofMinutes(10);
    public Duration codeTtl = Duration.ofMinutes(10);
    public Duration usedRetention = Duration.ofMinutes(5);
    public Duration stateTtl = Duration.ofMinutes(10);

    public Duration sharedSafetyMargin = Duration.ofMinutes(30);
    public Duration refreshThreshold = Duration.ofMinutes(5);

    public Duration accessTokenTtl = Duration.ofHours(1);
    public Duration refreshTokenTtl = Duration.ofDays(7);
    public boolean refreshTokensEnabled = true;

    public Duration lockWaitTimeout = Duration.ofSeconds(5);

    public StorageType storageType = StorageType.MEMORY;
    public int retryAttempts = 3;
    public Duration retryBackoff = Duration.ofMillis(1);

    public String authorizationEndpoint = "https://provider.example/connect/oauth2";
    public String tokenEndpoint = "https://provider.example/oauth2/tokens";
    public String providerClientId = "provider-client";
    public String providerClientSecret = "provider-secret";
    public String providerRedirectUri = "https://broker.example/oauth/callback";
    public String scope = "com.intuit.quickbooks.accounting";
    public Duration requestTimeout = Duration.ofSeconds(5);

    @Override
    public List<String> allowedRedirectHosts() {
        return allowedRedirectHosts;
    }

    @Override
    public Optional<String> defaultTenantId() {
        return Optional.ofNullable(defaultTenantId);
    }

    @Override
    public PkceConfig pkce() {
        return () -> challengeTtl;
    }

    @Override
    public CodeConfig code() {
        return new CodeConfig() {
            @Override
            public Duration ttl() {
                return codeTtl;
            }

            @Override
            public Duration usedRetention() {
                return usedRetention;
            }
        };
    }

    @Override
    public StateConfig state() {
        return () -> stateTtl;
    }

    @Override
    public SessionConfig session() {
        return new SessionConfig() {
            @Override
            public Duration sharedSafetyMargin() {
                return sharedSafetyMargin;
            }

            @Override
            public Duration refreshThreshold() {
                return refreshThreshold;
            }
        };
    }

    @Override
    public TokenConfig token() {
        return new TokenConfig() {
            @Override
            public Duration accessTokenTtl() {
                return accessTokenTtl;
            }

            @Override
            public Duration refreshTokenTtl() {
                return refreshTokenTtl;
            }

            @Override
            public boolean refreshTokensEnabled() {
                return refreshTokensEnabled;
            }
        };
    }

    @Override
    public LockConfig lock() {
        return () -> lockWaitTimeout;
    }

    @Override
    public StorageConfig storage() {
        return new StorageConfig() {
            @Override
            public StorageType type() {
                return storageType;
            }

            @Override
            public int retryAttempts() {
                return retryAttempts;
            }

            @Override
            public Duration retryBackoff() {
                return retryBackoff;
            }
        };
    }

    @Override
    public ProviderConfig provider() {
        return new ProviderConfig() {
            @Override
            public String authorizationEndpoint() {
                return authorizationEndpoint;
            }

            @Override
            public String tokenEndpoint() {
                return tokenEndpoint;
            }

            @Override
            public Optional<String> clientId() {
                return Optional.ofNullable(providerClientId);
            }

            @Override
            public Optional<String> clientSecret() {
                return Optional.ofNullable(providerClientSecret);
            }

            @Override
            public Optional<String> redirectUri() {
                return Optional.ofNullable(providerRedirectUri);
            }

            @Override
            public String scope() {
                return scope;
            }

            @Override
            public Duration requestTimeout() {
                return requestTimeout;
            }
        };
    }
}
