package tech.ledgerbridge.broker.gate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 envelopes exchanged on the protected-call gate.
 */
public final class JsonRpc {

    public static final String VERSION = "2.0";

    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;

    private JsonRpc() {
    }

    public record Request(String jsonrpc, JsonNode id, String method, JsonNode params) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Response(String jsonrpc, JsonNode id, Object result, Error error) {

        public static Response success(JsonNode id, Object result) {
            return new Response(VERSION, id, result, null);
        }

        public static Response failure(JsonNode id, int code, String message) {
            return new Response(VERSION, id, null, new Error(code, message, null));
        }

        public static Response failure(JsonNode id, int code, String message, Object data) {
            return new Response(VERSION, id, null, new Error(code, message, data));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Error(int code, String message, Object data) {
    }
}
