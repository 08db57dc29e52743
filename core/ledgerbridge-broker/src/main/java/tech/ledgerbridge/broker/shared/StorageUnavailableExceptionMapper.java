package tech.ledgerbridge.broker.shared;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * Maps exhausted storage retries to 503 so callers can retry the whole request.
 *
 * Response format:
 * <pre>
 * {
 *   "error": "temporarily_unavailable",
 *   "error_description": "Storage is temporarily unavailable, please retry"
 * }
 * </pre>
 */
@Provider
public class StorageUnavailableExceptionMapper implements ExceptionMapper<StorageUnavailableException> {

    @Override
    public Response toResponse(StorageUnavailableException exception) {
        var body = Map.of(
            "error", "temporarily_unavailable",
            "error_description", "Storage is temporarily unavailable, please retry"
        );

        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .type(MediaType.APPLICATION_JSON)
            .header("Retry-After", "5")
            .entity(body)
            .build();
    }
}
