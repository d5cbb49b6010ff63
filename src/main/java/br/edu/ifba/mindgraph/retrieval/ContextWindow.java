package br.edu.ifba.mindgraph.retrieval;

import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ranked nodes selected for a message plus the edges among them.
 *
 * @param profileId owning profile
 * @param nodes selected nodes, best first
 * @param edges edges whose endpoints are both selected
 * @param degraded true when retrieval failed or timed out and the window is empty because of it
 */
public record ContextWindow(
    @JsonProperty("profile_id") @NotNull String profileId,
    @JsonProperty("nodes") @NotNull List<ScoredNode> nodes,
    @JsonProperty("edges") @NotNull List<KnowledgeEdge> edges,
    @JsonProperty("degraded") boolean degraded
) {

    public ContextWindow {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    @NotNull
    public static ContextWindow empty(@NotNull String profileId) {
        return new ContextWindow(profileId, List.of(), List.of(), false);
    }

    @NotNull
    public static ContextWindow degraded(@NotNull String profileId) {
        return new ContextWindow(profileId, List.of(), List.of(), true);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @JsonIgnore
    @NotNull
    public List<KnowledgeNode> knowledgeNodes() {
        return nodes.stream().map(ScoredNode::node).toList();
    }

    /**
     * Compact text for the conversational agent's prompt. Empty when nothing is known.
     */
    @NotNull
    public String render() {
        if (nodes.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder("Known about the user:\n");
        Map<String, String> names = new HashMap<>();
        for (ScoredNode scored : nodes) {
            KnowledgeNode node = scored.node();
            names.put(node.getId(), node.getEntityName());
            text.append("- ").append(node.getEntityName())
                .append(" (").append(node.getEntityType().label().toLowerCase(Locale.ROOT));
            if (node.getMentionCount() > 1) {
                text.append(", mentioned ").append(node.getMentionCount()).append(" times");
            }
            text.append(")");
            node.getProperties().getValues().forEach((key, value) ->
                text.append("; ").append(key).append(": ").append(value));
            text.append('\n');
        }
        if (!edges.isEmpty()) {
            text.append("Relationships:\n");
            for (KnowledgeEdge edge : edges) {
                text.append("- ").append(names.get(edge.getSourceNodeId()))
                    .append(' ').append(edge.getRelationshipType().replace('_', ' '))
                    .append(' ').append(names.get(edge.getTargetNodeId()))
                    .append('\n');
            }
        }
        return text.toString().stripTrailing();
    }
}
