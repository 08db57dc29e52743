package tech.ledgerbridge.broker.refresh;

/**
 * Result of {@link TokenRefreshService#refreshIfNeeded(String)}.
 */
public enum RefreshOutcome {
    /** Token still has more than the refresh threshold left. */
    NOT_NEEDED,
    /** This call refreshed the tenant's tokens. */
    REFRESHED,
    /** Another caller refreshed the tenant while this one waited for the lock. */
    REFRESHED_BY_ANOTHER_CALLER
}
