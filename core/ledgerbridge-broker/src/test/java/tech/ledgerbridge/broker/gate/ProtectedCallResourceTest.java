package tech.ledgerbridge.broker.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProtectedCallResourceTest {

    private static final JsonNode ID = IntNode.valueOf(7);

    @Mock
    RequestAuthenticator authenticator;

    private ProtectedCallResource resource;

    @BeforeEach
    void setUp() {
        resource = new ProtectedCallResource();
        resource.authenticator = authenticator;
        resource.dispatcher = new PingOnlyDispatcher();
    }

    private static JsonRpc.Response body(Response response) {
        return (JsonRpc.Response) response.getEntity();
    }

    @Test
    @DisplayName("call should answer ping for an authenticated tenant")
    void call_shouldAnswerPing_whenAuthenticated() {
        when(authenticator.authenticate("Bearer t")).thenReturn(new AuthenticatedTenant("realm-1", "at", "session-1"));

        Response response = resource.call("Bearer t", new JsonRpc.Request("2.0", ID, "ping", null));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(body(response).error()).isNull();
        assertThat(body(response).id()).isEqualTo(ID);
    }

    @Test
    @DisplayName("call should map gate failures to their JSON-RPC codes and HTTP statuses")
    void call_shouldMapGateFailures() {
        when(authenticator.authenticate(any()))
            .thenThrow(new GateRejectedException(GateFailure.MISSING_CREDENTIALS, "none"))
            .thenThrow(new GateRejectedException(GateFailure.INVALID_TOKEN, "expired"))
            .thenThrow(new GateRejectedException(GateFailure.SESSION_NOT_FOUND, "gone"))
            .thenThrow(new GateRejectedException(GateFailure.REAUTHORIZATION_REQUIRED, "refused"))
            .thenThrow(new GateRejectedException(GateFailure.SESSION_ERROR, "lost"));
        JsonRpc.Request request = new JsonRpc.Request("2.0", ID, "ping", null);

        Response missing = resource.call(null, request);
        Response invalid = resource.call("Bearer x", request);
        Response notFound = resource.callMcp("Bearer x", request);
        Response reauth = resource.callMcp("Bearer x", request);
        Response error = resource.call("Bearer x", request);

        assertThat(missing.getStatus()).isEqualTo(401);
        assertThat(body(missing).error().code()).isEqualTo(-32001);
        assertThat(invalid.getStatus()).isEqualTo(401);
        assertThat(body(invalid).error().code()).isEqualTo(-32002);
        assertThat(notFound.getStatus()).isEqualTo(403);
        assertThat(body(notFound).error().code()).isEqualTo(-32003);
        assertThat(reauth.getStatus()).isEqualTo(401);
        assertThat(body(reauth).error().code()).isEqualTo(-32005);
        assertThat(error.getStatus()).isEqualTo(500);
        assertThat(body(error).error().code()).isEqualTo(-32004);
    }

    @Test
    @DisplayName("call should let callers tell unauthenticated from needing reauthorization")
    void call_shouldDistinguishReauthorizationFromUnauthenticated() {
        when(authenticator.authenticate(any()))
            .thenThrow(new GateRejectedException(GateFailure.MISSING_CREDENTIALS, "none"))
            .thenThrow(new GateRejectedException(GateFailure.REAUTHORIZATION_REQUIRED, "refused"))
            .thenThrow(new GateRejectedException(GateFailure.SESSION_NOT_FOUND, "gone"));
        JsonRpc.Request request = new JsonRpc.Request("2.0", ID, "ping", null);

        JsonRpc.Error unauthenticated = body(resource.call(null, request)).error();
        JsonRpc.Error reauthorize = body(resource.call("Bearer x", request)).error();
        JsonRpc.Error disconnected = body(resource.call("Bearer x", request)).error();

        assertThat(reauthorize.code()).isNotEqualTo(unauthenticated.code());
        assertThat(unauthenticated.data()).isEqualTo(Map.of("reauthorization_required", false));
        assertThat(reauthorize.data()).isEqualTo(Map.of("reauthorization_required", true));
        assertThat(disconnected.data()).isEqualTo(Map.of("reauthorization_required", true));
    }

    @Test
    @DisplayName("call should answer a JSON-RPC error with 503 when the connection is temporarily unavailable")
    void call_shouldReturnServiceUnavailable_whenTemporarilyUnavailable() {
        when(authenticator.authenticate("Bearer t"))
            .thenThrow(new GateRejectedException(GateFailure.TEMPORARILY_UNAVAILABLE, "lock timeout"));

        Response response = resource.call("Bearer t", new JsonRpc.Request("2.0", ID, "ping", null));

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(body(response).jsonrpc()).isEqualTo("2.0");
        assertThat(body(response).id()).isEqualTo(ID);
        assertThat(body(response).error().code()).isEqualTo(-32006);
        assertThat(body(response).error().data()).isEqualTo(Map.of("reauthorization_required", false));
    }

    @Test
    @DisplayName("call should reject JSON-RPC versions other than 2.0")
    void call_shouldRejectWrongVersion() {
        when(authenticator.authenticate("Bearer t")).thenReturn(new AuthenticatedTenant("realm-1", "at", "session-1"));

        Response response = resource.call("Bearer t", new JsonRpc.Request("1.0", ID, "ping", null));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response).error().code()).isEqualTo(-32600);
    }

    @Test
    @DisplayName("call should report unknown methods")
    void call_shouldReportUnknownMethod() {
        when(authenticator.authenticate("Bearer t")).thenReturn(new AuthenticatedTenant("realm-1", "at", "session-1"));

        Response response = resource.call("Bearer t", new JsonRpc.Request("2.0", ID, "tools/call", null));

        assertThat(body(response).error().code()).isEqualTo(-32601);
    }
}
