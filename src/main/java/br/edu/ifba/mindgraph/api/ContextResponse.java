package br.edu.ifba.mindgraph.api;

import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.retrieval.ContextWindow;
import br.edu.ifba.mindgraph.retrieval.ScoredNode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Retrieved context plus its prompt-ready rendering.
 */
public record ContextResponse(
    @JsonProperty("profile_id") String profileId,
    @JsonProperty("nodes") List<ScoredNode> nodes,
    @JsonProperty("edges") List<KnowledgeEdge> edges,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("rendered") String rendered
) {

    static ContextResponse from(ContextWindow window) {
        return new ContextResponse(window.profileId(), window.nodes(), window.edges(), window.degraded(),
            window.render());
    }
}
