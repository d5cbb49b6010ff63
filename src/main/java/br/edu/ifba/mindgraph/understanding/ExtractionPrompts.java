package br.edu.ifba.mindgraph.understanding;

import br.edu.ifba.mindgraph.core.EntityType;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts that turn a chat-completions model into a JSON-only fact extractor.
 *
 * <p>The expected answer is the same document the dedicated understanding
 * service returns, so both providers share {@link UnderstandingResponseParser}.</p>
 */
public final class ExtractionPrompts {

    static final String SYSTEM_TEMPLATE = """
        You extract durable facts about the user from a conversation in a mental-wellness app.
        Only record facts the user states or clearly implies about themselves and their life.
        Entity types: %s.
        Relationship types: %s.
        The user themself is the entity {"type":"person","name":"user"}.
        Answer with a single JSON object and nothing else:
        {"entities":[{"type":"...","name":"...","span":"...","confidence":0.0,"properties":{}}],
         "relations":[{"source":"...","target":"...","type":"...","confidence":0.0,"sourceType":"...","targetType":"..."}]}
        Confidence is between 0 and 1. Use an empty array when nothing applies.
        """;

    static final String USER_TEMPLATE = """
        Recent conversation:
        %s

        Current message:
        %s
        """;

    private ExtractionPrompts() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String systemPrompt(@NotNull List<String> relationshipTypes) {
        String entityTypes = Arrays.stream(EntityType.values())
            .map(EntityType::label)
            .collect(Collectors.joining(", "));
        return String.format(SYSTEM_TEMPLATE, entityTypes, String.join(", ", relationshipTypes));
    }

    @NotNull
    public static String userPrompt(@NotNull String text, @NotNull List<String> contextWindow) {
        String context = contextWindow.isEmpty()
            ? "(none)"
            : contextWindow.stream().map(turn -> "- " + turn).collect(Collectors.joining("\n"));
        return String.format(USER_TEMPLATE, context, text);
    }
}
