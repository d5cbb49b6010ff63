package br.edu.ifba.mindgraph.understanding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /v1/understand}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnderstandingRequest(
    String text,

    @JsonProperty("context_window")
    List<String> contextWindow,

    @JsonProperty("entity_types")
    List<String> entityTypes,

    @JsonProperty("relationship_types")
    List<String> relationshipTypes
) {
}
