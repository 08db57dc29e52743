package tech.ledgerbridge.broker.gate;

/**
 * Credentials handed to a protected call once the gate has let it through.
 *
 * @param tenantId    third-party company identifier
 * @param accessToken current third-party access token for the tenant
 * @param sessionId   broker session the bearer token belongs to
 */
public record AuthenticatedTenant(String tenantId, String accessToken, String sessionId) {

    @Override
    public String toString() {
        return "AuthenticatedTenant[tenantId=" + tenantId + ", sessionId=" + sessionId + "]";
    }
}
