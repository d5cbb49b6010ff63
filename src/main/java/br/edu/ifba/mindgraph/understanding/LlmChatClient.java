package br.edu.ifba.mindgraph.understanding;

import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * OpenAI-compatible chat completions client used by the {@code llm} provider.
 */
@RegisterRestClient(configKey = "llm-chat")
@RegisterProvider(UnderstandingClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}", required = false)
public interface LlmChatClient {

    @POST
    @Path("/chat/completions")
    @Timeout(value = 12000)
    @Retry(maxRetries = 2, delay = 250, jitter = 100, abortOn = UnderstandingRejectedException.class)
    LlmChatResponse chat(LlmChatRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("llm-chat.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
