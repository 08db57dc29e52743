package tech.ledgerbridge.broker.gate;

import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;

@DefaultBean
@ApplicationScoped
public class PingOnlyDispatcher implements ProtectedCallDispatcher {

    @Override
    public Object dispatch(AuthenticatedTenant tenant, String method, JsonNode params) throws MethodNotFoundException {
        if ("ping".equals(method)) {
            return Map.of();
        }
        throw new MethodNotFoundException(method);
    }
}
