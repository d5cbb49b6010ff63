package br.edu.ifba.mindgraph.storage;

import br.edu.ifba.mindgraph.core.EntityType;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate counts for one profile's graph.
 */
public record GraphStats(
    @JsonProperty("profile_id") String profileId,
    @JsonProperty("node_count") long nodeCount,
    @JsonProperty("edge_count") long edgeCount,
    @JsonProperty("nodes_by_type") Map<EntityType, Long> nodesByType,
    @JsonProperty("edges_by_relationship") Map<String, Long> edgesByRelationship,
    @JsonProperty("extraction_runs") long extractionRuns,
    @JsonProperty("last_mentioned") @Nullable Instant lastMentioned
) {

    public GraphStats {
        nodesByType = Map.copyOf(nodesByType);
        edgesByRelationship = Map.copyOf(edgesByRelationship);
    }

    public static GraphStats empty(String profileId) {
        return new GraphStats(profileId, 0, 0, Map.of(), Map.of(), 0, null);
    }
}
