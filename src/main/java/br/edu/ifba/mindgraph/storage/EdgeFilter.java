package br.edu.ifba.mindgraph.storage;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Set;

/**
 * Query options for {@link GraphStore#listEdges}. Results are ordered by
 * last update, newest first.
 *
 * @param nodeIds node ids to match against (empty means no node restriction)
 * @param match whether both endpoints or at least one must be in {@code nodeIds}
 * @param relationshipTypes restrict to these relationship types (empty means all)
 * @param limit maximum rows
 */
public record EdgeFilter(
    @NotNull Set<String> nodeIds,
    @NotNull EndpointMatch match,
    @NotNull Set<String> relationshipTypes,
    int limit
) {

    public static final int DEFAULT_LIMIT = 1000;

    /**
     * How {@link #nodeIds()} is applied.
     */
    public enum EndpointMatch {
        /** Source and target both in the set: the induced subgraph. */
        BOTH,
        /** Source or target in the set. */
        ANY
    }

    public EdgeFilter {
        nodeIds = Set.copyOf(nodeIds);
        relationshipTypes = Set.copyOf(relationshipTypes);
        if (match == null) {
            match = EndpointMatch.BOTH;
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
    }

    public static EdgeFilter all() {
        return new EdgeFilter(Set.of(), EndpointMatch.BOTH, Set.of(), DEFAULT_LIMIT);
    }

    public static EdgeFilter between(@NotNull Collection<String> nodeIds) {
        return new EdgeFilter(Set.copyOf(nodeIds), EndpointMatch.BOTH, Set.of(), DEFAULT_LIMIT);
    }

    public static EdgeFilter touching(@NotNull Collection<String> nodeIds) {
        return new EdgeFilter(Set.copyOf(nodeIds), EndpointMatch.ANY, Set.of(), DEFAULT_LIMIT);
    }

    public EdgeFilter withRelationshipTypes(@NotNull Collection<String> types) {
        return new EdgeFilter(nodeIds, match, Set.copyOf(types), limit);
    }

    public EdgeFilter withLimit(int newLimit) {
        return new EdgeFilter(nodeIds, match, relationshipTypes, newLimit);
    }
}
