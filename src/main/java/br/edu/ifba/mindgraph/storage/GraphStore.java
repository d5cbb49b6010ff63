package br.edu.ifba.mindgraph.storage;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence for per-profile knowledge graphs and their extraction logs.
 *
 * <p>Every operation is scoped to one profile; data of one profile is never
 * visible through another. Writes use compare-and-swap on the element's
 * {@code version}: version 0 means "insert, no row may exist yet", any other
 * version must match the stored one. A mismatch completes the future
 * exceptionally with {@link StorageConflictException}.</p>
 *
 * <p>Implementations: {@code SQLiteGraphStore}, {@code InMemoryGraphStore}.</p>
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Initializes the backend. Must be called before any other operation.
     */
    CompletableFuture<Void> initialize();

    // ===== Profile lifecycle =====

    /**
     * Registers the profile. Idempotent; writes also register implicitly.
     */
    CompletableFuture<Void> createProfileGraph(@NotNull String profileId);

    /**
     * Removes the profile with all nodes, edges and extraction logs. Idempotent.
     */
    CompletableFuture<Void> deleteProfileGraph(@NotNull String profileId);

    CompletableFuture<Boolean> profileGraphExists(@NotNull String profileId);

    // ===== Nodes =====

    /**
     * Inserts or updates a node with a version check.
     *
     * @param node the node; {@code version == 0} for an insert
     * @return the stored node carrying its new version
     */
    CompletableFuture<KnowledgeNode> upsertNode(@NotNull KnowledgeNode node);

    CompletableFuture<Optional<KnowledgeNode>> getNode(@NotNull String profileId, @NotNull String nodeId);

    /**
     * Fetches nodes by id. Unknown ids are skipped.
     */
    CompletableFuture<List<KnowledgeNode>> getNodes(@NotNull String profileId, @NotNull Collection<String> nodeIds);

    /**
     * Looks a node up by its identity (type, canonical name).
     */
    CompletableFuture<Optional<KnowledgeNode>> findNode(@NotNull String profileId, @NotNull EntityType type,
                                                        @NotNull String canonicalName);

    /**
     * Looks nodes up by canonical name across all entity types.
     */
    CompletableFuture<List<KnowledgeNode>> findNodesByCanonicalNames(@NotNull String profileId,
                                                                     @NotNull Collection<String> canonicalNames);

    CompletableFuture<List<KnowledgeNode>> listNodes(@NotNull String profileId, @NotNull NodeFilter filter);

    /**
     * Deletes a node and every edge touching it.
     *
     * @return true when the node existed
     */
    CompletableFuture<Boolean> deleteNode(@NotNull String profileId, @NotNull String nodeId);

    // ===== Edges =====

    /**
     * Inserts or updates an edge with a version check. Both endpoints must exist,
     * otherwise the future fails with {@link MissingEndpointException}.
     */
    CompletableFuture<KnowledgeEdge> upsertEdge(@NotNull KnowledgeEdge edge);

    CompletableFuture<Optional<KnowledgeEdge>> findEdge(@NotNull String profileId, @NotNull String sourceNodeId,
                                                        @NotNull String targetNodeId, @NotNull String relationshipType);

    CompletableFuture<List<KnowledgeEdge>> listEdges(@NotNull String profileId, @NotNull EdgeFilter filter);

    // ===== Extraction logs =====

    /**
     * Appends an entry. Entries are never updated afterwards.
     */
    CompletableFuture<Void> appendExtractionLog(@NotNull ExtractionLogEntry entry);

    /**
     * Finds the SUCCEEDED entry for a turn, if the turn was already processed.
     */
    CompletableFuture<Optional<ExtractionLogEntry>> findSuccessfulLog(@NotNull String profileId, @NotNull String turnId);

    /**
     * Lists entries newest first.
     */
    CompletableFuture<List<ExtractionLogEntry>> listExtractionLogs(@NotNull String profileId, int limit);

    // ===== Relationship vocabulary =====

    /**
     * Stores a relationship type appended at runtime.
     *
     * @return true when the term was not stored before
     */
    CompletableFuture<Boolean> addRelationshipType(@NotNull String term);

    /**
     * Relationship types appended at runtime, oldest first.
     */
    CompletableFuture<List<String>> listRelationshipTypes();

    // ===== Statistics =====

    CompletableFuture<GraphStats> getStats(@NotNull String profileId);

    /**
     * Releases backend resources. Does not throw checked exceptions.
     */
    @Override
    void close();
}
