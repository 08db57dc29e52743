package tech.ledgerbridge.broker.gate;

import jakarta.ws.rs.core.Response;

import java.util.Map;

/**
 * Reasons a protected call is turned away, with the JSON-RPC error each maps to.
 *
 * <p>Callers must tell the two families apart: an unauthenticated caller has to run
 * the outer OAuth flow again, while a caller needing reauthorization holds a valid
 * broker token but its tenant connection is gone or can no longer be refreshed.
 * Each family has its own codes, and {@link #errorData()} carries the flag on the wire.
 */
public enum GateFailure {

    MISSING_CREDENTIALS(-32001, Response.Status.UNAUTHORIZED, false,
        "Missing Authorization header. Please authenticate first."),

    INVALID_TOKEN(-32002, Response.Status.UNAUTHORIZED, false,
        "Invalid or expired token. Please re-authenticate."),

    SESSION_NOT_FOUND(-32003, Response.Status.FORBIDDEN, true,
        "Accounting session not found. Please re-authenticate."),

    REAUTHORIZATION_REQUIRED(-32005, Response.Status.UNAUTHORIZED, true,
        "Accounting authorization expired. Please disconnect and reconnect the integration."),

    SESSION_ERROR(-32004, Response.Status.INTERNAL_SERVER_ERROR, false,
        "Session error"),

    TEMPORARILY_UNAVAILABLE(-32006, Response.Status.SERVICE_UNAVAILABLE, false,
        "Accounting connection temporarily unavailable. Please retry shortly.");

    private final int rpcCode;
    private final Response.Status status;
    private final boolean needsReauthorization;
    private final String message;

    GateFailure(int rpcCode, Response.Status status, boolean needsReauthorization, String message) {
        this.rpcCode = rpcCode;
        this.status = status;
        this.needsReauthorization = needsReauthorization;
        this.message = message;
    }

    public int rpcCode() {
        return rpcCode;
    }

    public Response.Status status() {
        return status;
    }

    public boolean needsReauthorization() {
        return needsReauthorization;
    }

    public String message() {
        return message;
    }

    /**
     * JSON-RPC {@code error.data} for this failure.
     */
    public Map<String, Object> errorData() {
        return Map.of("reauthorization_required", needsReauthorization);
    }
}
