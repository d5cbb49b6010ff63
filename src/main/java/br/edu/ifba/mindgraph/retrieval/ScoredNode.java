package br.edu.ifba.mindgraph.retrieval;

import br.edu.ifba.mindgraph.core.KnowledgeNode;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * A retrieved node with the parts of its relevance score.
 */
public record ScoredNode(
    @JsonProperty("node") @NotNull KnowledgeNode node,
    @JsonProperty("score") double score,
    @JsonProperty("lexical") double lexical,
    @JsonProperty("recency") double recency,
    @JsonProperty("salience") double salience,
    @JsonProperty("explicit_mention") boolean explicitMention
) {
}
