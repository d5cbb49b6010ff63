package br.edu.ifba.mindgraph.understanding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Contract of the external text-understanding capability.
 *
 * <p>Returns the raw response body; callers parse and validate it with
 * {@link UnderstandingResponseParser} so the raw text can be kept for auditing.
 * The future fails with {@link TextUnderstandingException} when the service is
 * unreachable or answers with an error.</p>
 *
 * <p>Implementations: {@link RestTextUnderstandingService} ({@code rest}),
 * {@link LlmTextUnderstandingService} ({@code llm}), selected at build time by
 * {@code mindgraph.understanding.provider}.</p>
 */
public interface TextUnderstandingService {

    /**
     * @param text the conversation turn to analyze
     * @param contextWindow preceding utterances, oldest first
     * @return raw JSON response
     */
    CompletableFuture<String> understand(@NotNull String text, @NotNull List<String> contextWindow);

    /**
     * Provider name for logs.
     */
    String providerName();
}
