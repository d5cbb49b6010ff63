package br.edu.ifba.mindgraph.storage.impl;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.storage.EdgeFilter;
import br.edu.ifba.mindgraph.storage.GraphStats;
import br.edu.ifba.mindgraph.storage.GraphStorageException;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.MissingEndpointException;
import br.edu.ifba.mindgraph.storage.NodeFilter;
import br.edu.ifba.mindgraph.storage.StorageConflictException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Graph store backed by per-profile partitions of concurrent maps.
 *
 * <p>Writes to one profile are serialized on its partition so version checks and
 * cascades are atomic. Reads go straight to the maps and never block.</p>
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private static final Comparator<KnowledgeNode> BY_RECENCY =
        Comparator.comparing(KnowledgeNode::getLastMentioned).reversed()
            .thenComparing(KnowledgeNode::getId);
    private static final Comparator<KnowledgeNode> BY_SALIENCE =
        Comparator.comparingInt(KnowledgeNode::getMentionCount).reversed()
            .thenComparing(Comparator.comparingDouble(KnowledgeNode::getConfidence).reversed())
            .thenComparing(KnowledgeNode::getId);
    private static final Comparator<KnowledgeNode> BY_NAME =
        Comparator.comparing(KnowledgeNode::getCanonicalName).thenComparing(n -> n.getEntityType().name());

    private final ConcurrentHashMap<String, Partition> partitions = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> relationshipTypes = new CopyOnWriteArrayList<>();

    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    /**
     * One profile's graph.
     */
    private static final class Partition {
        // nodeId -> node
        final ConcurrentHashMap<String, KnowledgeNode> nodes = new ConcurrentHashMap<>();
        // identity key -> nodeId
        final ConcurrentHashMap<String, String> nodeIdsByKey = new ConcurrentHashMap<>();
        // edgeId -> edge
        final ConcurrentHashMap<String, KnowledgeEdge> edges = new ConcurrentHashMap<>();
        // identity key -> edgeId
        final ConcurrentHashMap<String, String> edgeIdsByKey = new ConcurrentHashMap<>();
        final CopyOnWriteArrayList<ExtractionLogEntry> logs = new CopyOnWriteArrayList<>();
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphStore initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Void> createProfileGraph(@NotNull String profileId) {
        return run(() -> {
            partition(profileId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteProfileGraph(@NotNull String profileId) {
        return run(() -> {
            Partition removed = partitions.remove(ProfileIds.requireValid(profileId));
            if (removed != null) {
                logger.debug("Deleted graph for profile {} ({} nodes, {} edges)",
                    profileId, removed.nodes.size(), removed.edges.size());
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> profileGraphExists(@NotNull String profileId) {
        return run(() -> partitions.containsKey(ProfileIds.requireValid(profileId)));
    }

    @Override
    public CompletableFuture<KnowledgeNode> upsertNode(@NotNull KnowledgeNode node) {
        return run(() -> {
            Partition p = partition(node.getProfileId());
            synchronized (p) {
                String key = node.identityKey();
                KnowledgeNode stored;
                if (node.getVersion() == 0) {
                    if (p.nodeIdsByKey.containsKey(key) || p.nodes.containsKey(node.getId())) {
                        throw new StorageConflictException(key, 0, "Node already exists: " + key);
                    }
                    stored = node.toBuilder().version(1).build();
                    p.nodeIdsByKey.put(key, stored.getId());
                } else {
                    KnowledgeNode current = p.nodes.get(node.getId());
                    if (current == null || current.getVersion() != node.getVersion()) {
                        throw new StorageConflictException(key, node.getVersion(),
                            "Node " + node.getId() + " changed or vanished (expected version " + node.getVersion() + ")");
                    }
                    if (!current.identityKey().equals(key)) {
                        throw new IllegalArgumentException("Node identity is immutable: " + current.identityKey() + " -> " + key);
                    }
                    stored = node.toBuilder().version(current.getVersion() + 1).build();
                }
                p.nodes.put(stored.getId(), stored);
                logger.debug("Upserted node {} v{} in profile {}", key, stored.getVersion(), node.getProfileId());
                return stored;
            }
        });
    }

    @Override
    public CompletableFuture<Optional<KnowledgeNode>> getNode(@NotNull String profileId, @NotNull String nodeId) {
        return run(() -> existing(profileId).map(p -> p.nodes.get(nodeId)));
    }

    @Override
    public CompletableFuture<List<KnowledgeNode>> getNodes(@NotNull String profileId, @NotNull Collection<String> nodeIds) {
        return run(() -> existing(profileId)
            .map(p -> nodeIds.stream().distinct().map(p.nodes::get).filter(n -> n != null).collect(Collectors.toList()))
            .orElseGet(List::of));
    }

    @Override
    public CompletableFuture<Optional<KnowledgeNode>> findNode(@NotNull String profileId, @NotNull EntityType type,
                                                               @NotNull String canonicalName) {
        return run(() -> existing(profileId).flatMap(p -> {
            String id = p.nodeIdsByKey.get(KnowledgeNode.identityKey(profileId, type, canonicalName));
            return id != null ? Optional.ofNullable(p.nodes.get(id)) : Optional.empty();
        }));
    }

    @Override
    public CompletableFuture<List<KnowledgeNode>> findNodesByCanonicalNames(@NotNull String profileId,
                                                                            @NotNull Collection<String> canonicalNames) {
        return run(() -> existing(profileId).map(p -> {
            List<KnowledgeNode> found = new ArrayList<>();
            for (String name : canonicalNames.stream().distinct().toList()) {
                for (EntityType type : EntityType.values()) {
                    String id = p.nodeIdsByKey.get(KnowledgeNode.identityKey(profileId, type, name));
                    KnowledgeNode node = id != null ? p.nodes.get(id) : null;
                    if (node != null) {
                        found.add(node);
                    }
                }
            }
            return found;
        }).orElseGet(List::of));
    }

    @Override
    public CompletableFuture<List<KnowledgeNode>> listNodes(@NotNull String profileId, @NotNull NodeFilter filter) {
        return run(() -> existing(profileId).map(p -> {
            Stream<KnowledgeNode> stream = p.nodes.values().stream();
            if (!filter.types().isEmpty()) {
                stream = stream.filter(n -> filter.types().contains(n.getEntityType()));
            }
            if (!filter.canonicalNames().isEmpty()) {
                stream = stream.filter(n -> filter.canonicalNames().contains(n.getCanonicalName()));
            }
            if (filter.mentionedSince() != null) {
                Instant since = filter.mentionedSince();
                stream = stream.filter(n -> !n.getLastMentioned().isBefore(since));
            }
            Comparator<KnowledgeNode> order = switch (filter.order()) {
                case RECENCY -> BY_RECENCY;
                case SALIENCE -> BY_SALIENCE;
                case NAME -> BY_NAME;
            };
            return stream.sorted(order).limit(filter.limit()).collect(Collectors.toList());
        }).orElseGet(List::of));
    }

    @Override
    public CompletableFuture<Boolean> deleteNode(@NotNull String profileId, @NotNull String nodeId) {
        return run(() -> {
            Optional<Partition> maybe = existing(profileId);
            if (maybe.isEmpty()) {
                return false;
            }
            Partition p = maybe.get();
            synchronized (p) {
                KnowledgeNode removed = p.nodes.remove(nodeId);
                if (removed == null) {
                    return false;
                }
                p.nodeIdsByKey.remove(removed.identityKey());
                List<KnowledgeEdge> touching = p.edges.values().stream()
                    .filter(e -> e.touches(nodeId))
                    .toList();
                for (KnowledgeEdge edge : touching) {
                    p.edges.remove(edge.getId());
                    p.edgeIdsByKey.remove(edge.identityKey());
                }
                logger.debug("Deleted node {} and {} edges in profile {}", nodeId, touching.size(), profileId);
                return true;
            }
        });
    }

    @Override
    public CompletableFuture<KnowledgeEdge> upsertEdge(@NotNull KnowledgeEdge edge) {
        return run(() -> {
            Partition p = partition(edge.getProfileId());
            synchronized (p) {
                for (String endpoint : List.of(edge.getSourceNodeId(), edge.getTargetNodeId())) {
                    if (!p.nodes.containsKey(endpoint)) {
                        throw new MissingEndpointException(edge.getProfileId(), endpoint);
                    }
                }
                String key = edge.identityKey();
                KnowledgeEdge stored;
                if (edge.getVersion() == 0) {
                    if (p.edgeIdsByKey.containsKey(key) || p.edges.containsKey(edge.getId())) {
                        throw new StorageConflictException(key, 0, "Edge already exists: " + key);
                    }
                    stored = edge.toBuilder().version(1).build();
                    p.edgeIdsByKey.put(key, stored.getId());
                } else {
                    KnowledgeEdge current = p.edges.get(edge.getId());
                    if (current == null || current.getVersion() != edge.getVersion()) {
                        throw new StorageConflictException(key, edge.getVersion(),
                            "Edge " + edge.getId() + " changed or vanished (expected version " + edge.getVersion() + ")");
                    }
                    if (!current.identityKey().equals(key)) {
                        throw new IllegalArgumentException("Edge identity is immutable: " + current.identityKey() + " -> " + key);
                    }
                    stored = edge.toBuilder().version(current.getVersion() + 1).build();
                }
                p.edges.put(stored.getId(), stored);
                logger.debug("Upserted edge {} v{}", key, stored.getVersion());
                return stored;
            }
        });
    }

    @Override
    public CompletableFuture<Optional<KnowledgeEdge>> findEdge(@NotNull String profileId, @NotNull String sourceNodeId,
                                                               @NotNull String targetNodeId, @NotNull String relationshipType) {
        return run(() -> existing(profileId).flatMap(p -> {
            String id = p.edgeIdsByKey.get(KnowledgeEdge.identityKey(profileId, sourceNodeId, targetNodeId, relationshipType));
            return id != null ? Optional.ofNullable(p.edges.get(id)) : Optional.empty();
        }));
    }

    @Override
    public CompletableFuture<List<KnowledgeEdge>> listEdges(@NotNull String profileId, @NotNull EdgeFilter filter) {
        return run(() -> existing(profileId).map(p -> p.edges.values().stream()
            // an edge whose endpoint is being deleted concurrently must not leak out
            .filter(e -> p.nodes.containsKey(e.getSourceNodeId()) && p.nodes.containsKey(e.getTargetNodeId()))
            .filter(e -> matchesEndpoints(e, filter))
            .filter(e -> filter.relationshipTypes().isEmpty() || filter.relationshipTypes().contains(e.getRelationshipType()))
            .sorted(Comparator.comparing(KnowledgeEdge::getLastUpdated).reversed().thenComparing(KnowledgeEdge::getId))
            .limit(filter.limit())
            .collect(Collectors.toList()))
            .orElseGet(List::of));
    }

    private static boolean matchesEndpoints(KnowledgeEdge edge, EdgeFilter filter) {
        if (filter.nodeIds().isEmpty()) {
            return true;
        }
        boolean source = filter.nodeIds().contains(edge.getSourceNodeId());
        boolean target = filter.nodeIds().contains(edge.getTargetNodeId());
        return filter.match() == EdgeFilter.EndpointMatch.BOTH ? source && target : source || target;
    }

    @Override
    public CompletableFuture<Void> appendExtractionLog(@NotNull ExtractionLogEntry entry) {
        return run(() -> {
            partition(entry.profileId()).logs.add(entry);
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<ExtractionLogEntry>> findSuccessfulLog(@NotNull String profileId, @NotNull String turnId) {
        return run(() -> existing(profileId).flatMap(p -> p.logs.stream()
            .filter(e -> e.status() == ExtractionStatus.SUCCEEDED && e.turnId().equals(turnId))
            .findFirst()));
    }

    @Override
    public CompletableFuture<List<ExtractionLogEntry>> listExtractionLogs(@NotNull String profileId, int limit) {
        return run(() -> existing(profileId).map(p -> {
            List<ExtractionLogEntry> all = new ArrayList<>(p.logs);
            List<ExtractionLogEntry> newestFirst = new ArrayList<>(all.size());
            for (int i = all.size() - 1; i >= 0 && newestFirst.size() < limit; i--) {
                newestFirst.add(all.get(i));
            }
            return newestFirst;
        }).orElseGet(List::of));
    }

    @Override
    public CompletableFuture<Boolean> addRelationshipType(@NotNull String term) {
        return run(() -> relationshipTypes.addIfAbsent(term));
    }

    @Override
    public CompletableFuture<List<String>> listRelationshipTypes() {
        return run(() -> List.copyOf(relationshipTypes));
    }

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String profileId) {
        return run(() -> existing(profileId).map(p -> {
            Map<EntityType, Long> byType = new EnumMap<>(EntityType.class);
            Instant lastMentioned = null;
            for (KnowledgeNode node : p.nodes.values()) {
                byType.merge(node.getEntityType(), 1L, Long::sum);
                if (lastMentioned == null || node.getLastMentioned().isAfter(lastMentioned)) {
                    lastMentioned = node.getLastMentioned();
                }
            }
            Map<String, Long> byRelationship = new HashMap<>();
            for (KnowledgeEdge edge : p.edges.values()) {
                byRelationship.merge(edge.getRelationshipType(), 1L, Long::sum);
            }
            return new GraphStats(profileId, p.nodes.size(), p.edges.size(), byType, byRelationship,
                p.logs.size(), lastMentioned);
        }).orElseGet(() -> GraphStats.empty(profileId)));
    }

    @Override
    public void close() {
        closed = true;
        partitions.clear();
        relationshipTypes.clear();
        logger.info("InMemoryGraphStore closed");
    }

    private Partition partition(String profileId) {
        return partitions.computeIfAbsent(ProfileIds.requireValid(profileId), id -> new Partition());
    }

    private Optional<Partition> existing(String profileId) {
        return Optional.ofNullable(partitions.get(ProfileIds.requireValid(profileId)));
    }

    private <T> CompletableFuture<T> run(Supplier<T> action) {
        if (closed) {
            return CompletableFuture.failedFuture(new GraphStorageException("Graph store is closed"));
        }
        if (!initialized) {
            return CompletableFuture.failedFuture(new IllegalStateException("InMemoryGraphStore not initialized"));
        }
        return CompletableFuture.supplyAsync(action);
    }
}
