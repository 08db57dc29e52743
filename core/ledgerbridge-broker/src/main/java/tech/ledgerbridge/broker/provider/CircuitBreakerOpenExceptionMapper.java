package tech.ledgerbridge.broker.provider;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * The third-party token endpoint is failing; report 503 until the circuit closes.
 */
@Provider
public class CircuitBreakerOpenExceptionMapper implements ExceptionMapper<CircuitBreakerOpenException> {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerOpenExceptionMapper.class);

    @Override
    public Response toResponse(CircuitBreakerOpenException exception) {
        LOG.warnf("Third-party token endpoint circuit is open: %s", exception.getMessage());

        var body = Map.of(
            "error", "temporarily_unavailable",
            "error_description", "The accounting provider is currently unavailable, please retry shortly"
        );

        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .type(MediaType.APPLICATION_JSON)
            .header("Retry-After", "5")
            .entity(body)
            .build();
    }
}
