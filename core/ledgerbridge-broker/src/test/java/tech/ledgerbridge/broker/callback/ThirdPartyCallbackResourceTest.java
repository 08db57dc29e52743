package tech.ledgerbridge.broker.callback;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.ledgerbridge.broker.shared.StorageUnavailableException;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ThirdPartyCallbackResourceTest {

    @Mock
    ThirdPartyCallbackHandler handler;

    @InjectMocks
    ThirdPartyCallbackResource resource;

    @Test
    @DisplayName("callback should redirect to the outer client on success")
    void callback_shouldRedirect_whenCompleted() {
        URI location = URI.create("https://claude.ai/api/mcp/auth_callback?code=c&state=s");
        when(handler.handle("qb-code", "realm-1", "inner", null, null))
            .thenReturn(new CallbackOutcome.Completed(location, "session-1", "realm-1", false));

        Response response = resource.callback("qb-code", "realm-1", null, "inner", null, null);

        assertThat(response.getStatus()).isEqualTo(303);
        assertThat(response.getLocation()).isEqualTo(location);
    }

    @Test
    @DisplayName("callback should render the 503 page chosen by the handler")
    void callback_shouldRenderUnavailablePage_whenHandlerReportsUnavailable() {
        when(handler.handle("qb-code", "realm-1", "inner", null, null))
            .thenReturn(CallbackOutcome.Failed.unavailable());

        Response response = resource.callback("qb-code", "realm-1", null, "inner", null, null);

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.getMediaType().isCompatible(MediaType.TEXT_HTML_TYPE)).isTrue();
        assertThat((String) response.getEntity()).contains("Temporarily Unavailable");
    }

    @Test
    @DisplayName("callback should render an HTML 503 page when storage stays unreachable")
    void callback_shouldRenderUnavailablePage_whenStorageUnavailable() {
        when(handler.handle("qb-code", "realm-1", "inner", null, null))
            .thenThrow(new StorageUnavailableException("connect", 3, new RuntimeException("down")));

        Response response = resource.callback("qb-code", "realm-1", null, "inner", null, null);

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.getMediaType().isCompatible(MediaType.TEXT_HTML_TYPE)).isTrue();
    }
}
