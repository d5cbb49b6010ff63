package br.edu.ifba.mindgraph.understanding;

import br.edu.ifba.mindgraph.resolve.RelationshipVocabulary;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Understanding through an OpenAI-compatible chat completions endpoint with a
 * JSON-only extraction prompt.
 */
@ApplicationScoped
@IfBuildProperty(name = "mindgraph.understanding.provider", stringValue = "llm")
public class LlmTextUnderstandingService implements TextUnderstandingService {

    private static final Logger LOG = Logger.getLogger(LlmTextUnderstandingService.class);

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @Inject
    RelationshipVocabulary vocabulary;

    @Inject
    UnderstandingThreads threads;

    @ConfigProperty(name = "mindgraph.understanding.llm.model")
    String model;

    @ConfigProperty(name = "mindgraph.understanding.llm.temperature", defaultValue = "0.0")
    Double temperature;

    @ConfigProperty(name = "mindgraph.understanding.llm.max-tokens", defaultValue = "1024")
    Integer maxTokens;

    @Override
    public CompletableFuture<String> understand(@NotNull String text, @NotNull List<String> contextWindow) {
        List<ChatMessage> messages = List.of(
            ChatMessage.system(ExtractionPrompts.systemPrompt(vocabulary.terms())),
            ChatMessage.user(ExtractionPrompts.userPrompt(text, contextWindow)));
        LlmChatRequest request = LlmChatRequest.jsonOnly(model, messages, maxTokens, temperature);

        return CompletableFuture.supplyAsync(() -> {
            LOG.debugf("Calling LLM with model: %s, temperature: %.2f, maxTokens: %d",
                model, Double.valueOf(temperature), Integer.valueOf(maxTokens));
            LlmChatResponse response;
            try {
                response = chatClient.chat(request);
            } catch (TextUnderstandingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TextUnderstandingException("LLM unavailable: " + e.getMessage(), e);
            }

            String content = response != null ? response.firstContent() : null;
            if (content == null) {
                throw new MalformedUnderstandingException("LLM returned no choices in response");
            }
            String tokenInfo = response.usage() != null ? String.valueOf(response.usage().totalTokens()) : "unknown";
            LOG.debugf("LLM response received - length: %d characters, tokens: %s",
                Integer.valueOf(content.length()), tokenInfo);
            return content;
        }, threads.executor());
    }

    @Override
    public String providerName() {
        return "llm";
    }
}
