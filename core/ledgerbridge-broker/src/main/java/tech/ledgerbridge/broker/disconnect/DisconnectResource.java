package tech.ledgerbridge.broker.disconnect;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.lock.LockTimeoutException;
import tech.ledgerbridge.broker.shared.HtmlPages;
import tech.ledgerbridge.broker.shared.StorageUnavailableException;

/**
 * Disconnect URL registered with the accounting provider.
 */
@Path("/disconnect")
@Tag(name = "Third-Party OAuth", description = "Callback from the accounting provider")
public class DisconnectResource {

    private static final Logger LOG = Logger.getLogger(DisconnectResource.class);

    @Inject
    DisconnectService disconnectService;

    @GET
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Forget all sessions of a company")
    public Response disconnect(
            @Parameter(description = "Company identifier")
            @QueryParam("realmId") String realmId
    ) {
        if (realmId == null || realmId.isBlank()) {
            return HtmlPages.error(Response.Status.BAD_REQUEST, "Disconnect Failed", "Missing realmId parameter.");
        }

        int removed;
        try {
            removed = disconnectService.disconnect(realmId);
        } catch (LockTimeoutException | StorageUnavailableException e) {
            LOG.warnf("Disconnect for tenant %s not completed: %s", realmId, e.getMessage());
            return HtmlPages.error(Response.Status.SERVICE_UNAVAILABLE, "Temporarily Unavailable",
                "The disconnect could not be completed right now. Please try again in a moment.");
        }
        if (removed == 0) {
            return HtmlPages.success("Already Disconnected",
                "No active connection was found for this company.");
        }
        return HtmlPages.success("Disconnected",
            "Your accounting company has been disconnected.",
            "You can reconnect at any time from your AI client.");
    }
}
