package br.edu.ifba.mindgraph.understanding;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature,

    @JsonProperty("response_format")
    Map<String, Object> responseFormat,

    /**
     * OpenRouter reasoning configuration. {"effort": "none"} disables reasoning tokens.
     */
    Map<String, Object> reasoning
) {
    private static final Map<String, Object> REASONING_DISABLED = Map.of("effort", "none");

    private static final Map<String, Object> JSON_OBJECT = Map.of("type", "json_object");

    /**
     * Non-streaming request asking for a JSON object response.
     */
    public static LlmChatRequest jsonOnly(
            final String model,
            final List<ChatMessage> messages,
            final Integer maxTokens,
            final Double temperature) {
        return new LlmChatRequest(model, messages, false, maxTokens, temperature, JSON_OBJECT, REASONING_DISABLED);
    }
}
