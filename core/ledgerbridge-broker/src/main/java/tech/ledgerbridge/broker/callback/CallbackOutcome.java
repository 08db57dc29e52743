package tech.ledgerbridge.broker.callback;

import jakarta.ws.rs.core.Response;

import java.net.URI;

/**
 * Result of handling the third party's redirect back to the broker.
 */
public sealed interface CallbackOutcome permits CallbackOutcome.Completed, CallbackOutcome.Failed {

    /**
     * @param shared true when the tenant's existing connection was reused instead of
     *               exchanging the third-party code
     */
    record Completed(URI location, String sessionId, String tenantId, boolean shared) implements CallbackOutcome {
    }

    record Failed(Response.Status status, String title, String message) implements CallbackOutcome {

        static Failed unavailable() {
            return new Failed(Response.Status.SERVICE_UNAVAILABLE, "Temporarily Unavailable",
                "The accounting provider could not be reached. Please try again in a moment.");
        }
    }
}
