package br.edu.ifba.mindgraph.understanding;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.resolve.RelationshipVocabulary;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Calls a dedicated understanding service at {@code POST /v1/understand}.
 */
@ApplicationScoped
@IfBuildProperty(name = "mindgraph.understanding.provider", stringValue = "rest", enableIfMissing = true)
public class RestTextUnderstandingService implements TextUnderstandingService {

    private static final Logger LOG = Logger.getLogger(RestTextUnderstandingService.class);

    private static final List<String> ENTITY_TYPES = Arrays.stream(EntityType.values())
        .map(EntityType::label)
        .toList();

    @Inject
    @RestClient
    TextUnderstandingClient client;

    @Inject
    RelationshipVocabulary vocabulary;

    @Inject
    UnderstandingThreads threads;

    @Override
    public CompletableFuture<String> understand(@NotNull String text, @NotNull List<String> contextWindow) {
        UnderstandingRequest request = new UnderstandingRequest(text, contextWindow, ENTITY_TYPES, vocabulary.terms());
        return CompletableFuture.supplyAsync(() -> {
            LOG.debugf("Understanding request - text length: %d, context turns: %d",
                Integer.valueOf(text.length()), Integer.valueOf(contextWindow.size()));
            try {
                String body = client.understand(request);
                LOG.debugf("Understanding response - length: %d", Integer.valueOf(body != null ? body.length() : 0));
                return body;
            } catch (TextUnderstandingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TextUnderstandingException("Understanding service unavailable: " + e.getMessage(), e);
            }
        }, threads.executor());
    }

    @Override
    public String providerName() {
        return "rest";
    }
}
