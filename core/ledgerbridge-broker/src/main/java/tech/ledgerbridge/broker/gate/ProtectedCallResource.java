package tech.ledgerbridge.broker.gate;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * Protected-call gate. Every JSON-RPC request must carry a broker bearer token.
 *
 * Served on both {@code POST /} and {@code POST /mcp}.
 */
@Path("/")
@Tag(name = "Protected Calls", description = "JSON-RPC 2.0 calls on behalf of a connected company")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class ProtectedCallResource {

    private static final Logger LOG = Logger.getLogger(ProtectedCallResource.class);

    @Inject
    RequestAuthenticator authenticator;

    @Inject
    ProtectedCallDispatcher dispatcher;

    @POST
    @Operation(summary = "Execute a JSON-RPC call")
    public Response call(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, JsonRpc.Request request) {
        return handle(authorization, request);
    }

    @POST
    @Path("mcp")
    @Operation(summary = "Execute a JSON-RPC call")
    public Response callMcp(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, JsonRpc.Request request) {
        return handle(authorization, request);
    }

    private Response handle(String authorization, JsonRpc.Request request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(JsonRpc.Response.failure(null, JsonRpc.INVALID_REQUEST, "Invalid Request"))
                .build();
        }

        AuthenticatedTenant tenant;
        try {
            tenant = authenticator.authenticate(authorization);
        } catch (GateRejectedException e) {
            GateFailure failure = e.getFailure();
            LOG.infof("Protected call %s rejected: %s", request.method(), e.getMessage());
            return Response.status(failure.status())
                .entity(JsonRpc.Response.failure(request.id(), failure.rpcCode(), failure.message(), failure.errorData()))
                .build();
        }

        if (!JsonRpc.VERSION.equals(request.jsonrpc())) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(JsonRpc.Response.failure(request.id(), JsonRpc.INVALID_REQUEST, "Invalid JSON-RPC version"))
                .build();
        }

        try {
            Object result = dispatcher.dispatch(tenant, request.method(), request.params());
            return Response.ok(JsonRpc.Response.success(request.id(), result)).build();
        } catch (MethodNotFoundException e) {
            return Response.ok(JsonRpc.Response.failure(request.id(), JsonRpc.METHOD_NOT_FOUND, e.getMessage())).build();
        }
    }
}
