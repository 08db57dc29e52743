package tech.ledgerbridge.broker.callback;

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
import tech.ledgerbridge.broker.shared.HtmlPages;
import tech.ledgerbridge.broker.shared.StorageUnavailableException;

/**
 * Redirect target registered with the accounting provider.
 */
@Path("/oauth/callback")
@Tag(name = "Third-Party OAuth", description = "Callback from the accounting provider")
public class ThirdPartyCallbackResource {

    private static final Logger LOG = Logger.getLogger(ThirdPartyCallbackResource.class);

    @Inject
    ThirdPartyCallbackHandler handler;

    @GET
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Complete the third-party authorization and return to the outer client")
    public Response callback(
            @Parameter(description = "Third-party authorization code")
            @QueryParam("code") String code,

            @Parameter(description = "Company identifier")
            @QueryParam("realmId") String realmId,

            @Parameter(description = "Company identifier, for providers that do not send realmId")
            @QueryParam("tenantId") String tenantId,

            @Parameter(description = "State issued by /authorize")
            @QueryParam("state") String state,

            @QueryParam("error") String error,

            @QueryParam("error_description") String errorDescription
    ) {
        CallbackOutcome outcome;
        try {
            outcome = handler.handle(code, realmId != null ? realmId : tenantId, state, error, errorDescription);
        } catch (StorageUnavailableException e) {
            LOG.warnf("Callback could not be completed: %s", e.getMessage());
            outcome = CallbackOutcome.Failed.unavailable();
        }

        if (outcome instanceof CallbackOutcome.Completed completed) {
            return Response.seeOther(completed.location()).build();
        }

        CallbackOutcome.Failed failed = (CallbackOutcome.Failed) outcome;
        return HtmlPages.error(failed.status(), failed.title(), failed.message(),
            "Please close this window and try connecting again.");
    }
}
