package br.edu.ifba.mindgraph.understanding;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Client for a dedicated text-understanding service.
 *
 * <p>The body is returned as text so the caller can keep the raw output.</p>
 */
@RegisterRestClient(configKey = "text-understanding")
@RegisterProvider(UnderstandingClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}", required = false)
@Path("/v1")
public interface TextUnderstandingClient {

    @POST
    @Path("/understand")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Timeout(value = 10000)
    @Retry(maxRetries = 2, delay = 250, jitter = 100, abortOn = UnderstandingRejectedException.class)
    String understand(UnderstandingRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("text-understanding.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
