package tech.ledgerbridge.broker.gate;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executes a protected call on behalf of an authenticated tenant.
 *
 * Applications replace the default bean with one that talks to the accounting API
 * using {@link AuthenticatedTenant#accessToken()}.
 */
public interface ProtectedCallDispatcher {

    /**
     * @return the JSON-RPC result, serialized with Jackson
     * @throws MethodNotFoundException if the method is not handled
     */
    Object dispatch(AuthenticatedTenant tenant, String method, JsonNode params) throws MethodNotFoundException;
}
