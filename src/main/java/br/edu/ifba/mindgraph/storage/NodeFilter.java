package br.edu.ifba.mindgraph.storage;

import br.edu.ifba.mindgraph.core.EntityType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Query options for {@link GraphStore#listNodes}.
 *
 * @param types restrict to these entity types (empty means all)
 * @param canonicalNames restrict to these canonical names (empty means all)
 * @param mentionedSince only nodes mentioned at or after this instant (null means no bound)
 * @param order sort order
 * @param limit maximum rows, must be positive
 */
public record NodeFilter(
    @NotNull Set<EntityType> types,
    @NotNull Set<String> canonicalNames,
    @Nullable Instant mentionedSince,
    @NotNull NodeOrder order,
    int limit
) {

    public static final int DEFAULT_LIMIT = 500;

    public NodeFilter {
        types = types.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(types));
        canonicalNames = Set.copyOf(canonicalNames);
        if (order == null) {
            order = NodeOrder.RECENCY;
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
    }

    public static NodeFilter all() {
        return new NodeFilter(Set.of(), Set.of(), null, NodeOrder.NAME, DEFAULT_LIMIT);
    }

    public static NodeFilter mostRecent(int limit) {
        return new NodeFilter(Set.of(), Set.of(), null, NodeOrder.RECENCY, limit);
    }

    public static NodeFilter mostSalient(int limit) {
        return new NodeFilter(Set.of(), Set.of(), null, NodeOrder.SALIENCE, limit);
    }

    public NodeFilter withTypes(@NotNull Collection<EntityType> newTypes) {
        return new NodeFilter(newTypes.isEmpty() ? Set.of() : EnumSet.copyOf(newTypes),
            canonicalNames, mentionedSince, order, limit);
    }

    public NodeFilter withCanonicalNames(@NotNull Collection<String> names) {
        return new NodeFilter(types, Set.copyOf(names), mentionedSince, order, limit);
    }

    public NodeFilter withMentionedSince(@Nullable Instant since) {
        return new NodeFilter(types, canonicalNames, since, order, limit);
    }

    public NodeFilter withOrder(@NotNull NodeOrder newOrder) {
        return new NodeFilter(types, canonicalNames, mentionedSince, newOrder, limit);
    }

    public NodeFilter withLimit(int newLimit) {
        return new NodeFilter(types, canonicalNames, mentionedSince, order, newLimit);
    }
}
