package tech.ledgerbridge.broker.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the state token sent to the third party.
 *
 * @param version schema version, currently {@value InnerStateCodec#CURRENT_VERSION}
 * @param outerState state the outer client sent to /authorize
 * @param sessionId session created for this authorization
 * @param nonce random value so identical flows never share a token
 * @param issuedAt epoch millis at issue
 */
public record InnerState(
    @JsonProperty("v") int version,
    @JsonProperty("outerState") String outerState,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("issuedAt") long issuedAt
) {
}
