package tech.ledgerbridge.broker.authorize;

import java.net.URI;

/**
 * What /authorize does with a request.
 */
public sealed interface AuthorizeOutcome
    permits AuthorizeOutcome.RedirectToClient, AuthorizeOutcome.RedirectToProvider, AuthorizeOutcome.Rejected {

    /**
     * The tenant was already connected; the outer client gets its code immediately.
     */
    record RedirectToClient(URI location, String sessionId) implements AuthorizeOutcome {
    }

    /**
     * The user must consent at the third party first.
     */
    record RedirectToProvider(URI location, String sessionId, String innerState) implements AuthorizeOutcome {
    }

    /**
     * The request is malformed. {@code error} is always {@code invalid_request}.
     */
    record Rejected(String error, String field, String description) implements AuthorizeOutcome {

        static Rejected invalidRequest(String field, String description) {
            return new Rejected("invalid_request", field, description);
        }
    }
}
