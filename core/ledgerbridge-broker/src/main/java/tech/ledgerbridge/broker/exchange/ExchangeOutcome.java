package tech.ledgerbridge.broker.exchange;

import jakarta.ws.rs.core.Response;
import tech.ledgerbridge.broker.token.BrokerToken;

/**
 * Result of a token endpoint grant.
 */
public sealed interface ExchangeOutcome permits ExchangeOutcome.Issued, ExchangeOutcome.Failed {

    record Issued(BrokerToken token) implements ExchangeOutcome {
    }

    record Failed(Response.Status status, String error, String description) implements ExchangeOutcome {

        static Failed invalidRequest(String description) {
            return new Failed(Response.Status.BAD_REQUEST, "invalid_request", description);
        }

        static Failed invalidGrant(String description) {
            return new Failed(Response.Status.BAD_REQUEST, "invalid_grant", description);
        }
    }
}
