package tech.ledgerbridge.broker.lock;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Contention on a tenant lock is transient; report 503 rather than a server error.
 */
@Provider
public class LockTimeoutExceptionMapper implements ExceptionMapper<LockTimeoutException> {

    private static final Logger LOG = Logger.getLogger(LockTimeoutExceptionMapper.class);

    @Override
    public Response toResponse(LockTimeoutException exception) {
        LOG.warnf("Tenant lock contention for [%s]: %s", exception.getTenantId(), exception.getMessage());

        var body = Map.of(
            "error", "temporarily_unavailable",
            "error_description", "Another operation for this company is in progress, please retry"
        );

        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .type(MediaType.APPLICATION_JSON)
            .header("Retry-After", "2")
            .entity(body)
            .build();
    }
}
