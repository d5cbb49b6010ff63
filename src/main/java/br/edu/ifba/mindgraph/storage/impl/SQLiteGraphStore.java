package br.edu.ifba.mindgraph.storage.impl;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionErrorKind;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.core.NodeProperties;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.storage.EdgeFilter;
import br.edu.ifba.mindgraph.storage.GraphStats;
import br.edu.ifba.mindgraph.storage.GraphStorageException;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.MissingEndpointException;
import br.edu.ifba.mindgraph.storage.NodeFilter;
import br.edu.ifba.mindgraph.storage.StorageConflictException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite implementation of {@link GraphStore}.
 *
 * <p>Nodes, edges and extraction logs live in relational tables keyed by
 * {@code profile_id}. Writes go through the single write connection inside a
 * transaction; version checks are expressed in the {@code WHERE} clause so a
 * concurrent change shows up as zero updated rows. Deleting a node or a profile
 * relies on {@code ON DELETE CASCADE}.</p>
 */
public final class SQLiteGraphStore implements GraphStore {

    private static final Logger LOG = Logger.getLogger(SQLiteGraphStore.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<ExtractionIssue>> ISSUE_LIST_TYPE = new TypeReference<>() {};

    private static final String NODE_COLUMNS =
        "id, profile_id, entity_type, entity_name, canonical_name, properties, confidence, "
            + "mention_count, last_mentioned, created_at, version";
    private static final String EDGE_COLUMNS =
        "id, profile_id, source_node_id, target_node_id, relationship_type, confidence, "
            + "occurrences, last_updated, created_at, version";
    private static final String LOG_COLUMNS =
        "id, profile_id, turn_id, input_excerpt, raw_output, node_ids, edge_ids, status, "
            + "error_kind, error_message, issues, duration_ms, created_at";

    private final SQLiteConnectionManager connectionManager;

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    public SQLiteGraphStore(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> LOG.infof("Initialized SQLiteGraphStore on %s",
            connectionManager.getDatabasePath()));
    }

    // ========== Profile lifecycle ==========

    @Override
    public CompletableFuture<Void> createProfileGraph(@NotNull String profileId) {
        return CompletableFuture.runAsync(() -> write("createProfileGraph", conn -> {
            ensureProfile(conn, ProfileIds.requireValid(profileId));
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> deleteProfileGraph(@NotNull String profileId) {
        return CompletableFuture.runAsync(() -> write("deleteProfileGraph", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM profiles WHERE id = ?")) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                int deleted = stmt.executeUpdate();
                LOG.debugf("Deleted graph for profile %s (existed=%s)", profileId, Boolean.valueOf(deleted > 0));
            }
            return null;
        }));
    }

    @Override
    public CompletableFuture<Boolean> profileGraphExists(@NotNull String profileId) {
        return CompletableFuture.supplyAsync(() -> read("profileGraphExists", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM profiles WHERE id = ?")) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next();
                }
            }
        }));
    }

    // ========== Nodes ==========

    @Override
    public CompletableFuture<KnowledgeNode> upsertNode(@NotNull KnowledgeNode node) {
        return CompletableFuture.supplyAsync(() -> write("upsertNode", conn -> {
            ensureProfile(conn, ProfileIds.requireValid(node.getProfileId()));
            return node.getVersion() == 0 ? insertNode(conn, node) : updateNode(conn, node);
        }));
    }

    private KnowledgeNode insertNode(Connection conn, KnowledgeNode node) throws SQLException {
        String sql = "INSERT INTO graph_nodes (" + NODE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1) "
            + "ON CONFLICT DO NOTHING";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, node.getId());
            stmt.setString(2, node.getProfileId());
            stmt.setString(3, node.getEntityType().name());
            stmt.setString(4, node.getEntityName());
            stmt.setString(5, node.getCanonicalName());
            stmt.setString(6, toJson(node.getProperties()));
            stmt.setDouble(7, node.getConfidence());
            stmt.setInt(8, node.getMentionCount());
            stmt.setLong(9, node.getLastMentioned().toEpochMilli());
            stmt.setLong(10, node.getCreatedAt().toEpochMilli());
            if (stmt.executeUpdate() == 0) {
                throw new StorageConflictException(node.identityKey(), 0, "Node already exists: " + node.identityKey());
            }
        }
        LOG.debugf("Inserted node %s", node.identityKey());
        return node.toBuilder().version(1).build();
    }

    private KnowledgeNode updateNode(Connection conn, KnowledgeNode node) throws SQLException {
        String sql = """
            UPDATE graph_nodes SET
                entity_name = ?, properties = ?, confidence = ?, mention_count = ?,
                last_mentioned = ?, version = version + 1
            WHERE id = ? AND profile_id = ? AND entity_type = ? AND canonical_name = ? AND version = ?
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, node.getEntityName());
            stmt.setString(2, toJson(node.getProperties()));
            stmt.setDouble(3, node.getConfidence());
            stmt.setInt(4, node.getMentionCount());
            stmt.setLong(5, node.getLastMentioned().toEpochMilli());
            stmt.setString(6, node.getId());
            stmt.setString(7, node.getProfileId());
            stmt.setString(8, node.getEntityType().name());
            stmt.setString(9, node.getCanonicalName());
            stmt.setLong(10, node.getVersion());
            if (stmt.executeUpdate() == 0) {
                throw new StorageConflictException(node.identityKey(), node.getVersion(),
                    "Node " + node.getId() + " changed or vanished (expected version " + node.getVersion() + ")");
            }
        }
        LOG.debugf("Updated node %s to version %d", node.identityKey(), Long.valueOf(node.getVersion() + 1));
        return node.toBuilder().version(node.getVersion() + 1).build();
    }

    @Override
    public CompletableFuture<Optional<KnowledgeNode>> getNode(@NotNull String profileId, @NotNull String nodeId) {
        return CompletableFuture.supplyAsync(() -> read("getNode", conn -> {
            String sql = "SELECT " + NODE_COLUMNS + " FROM graph_nodes WHERE profile_id = ? AND id = ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                stmt.setString(2, nodeId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(nodeFromResultSet(rs)) : Optional.<KnowledgeNode>empty();
                }
            }
        }));
    }

    @Override
    public CompletableFuture<List<KnowledgeNode>> getNodes(@NotNull String profileId, @NotNull Collection<String> nodeIds) {
        return CompletableFuture.supplyAsync(() -> {
            ProfileIds.requireValid(profileId);
            if (nodeIds.isEmpty()) {
                return List.<KnowledgeNode>of();
            }
            return read("getNodes", conn -> {
                List<String> ids = List.copyOf(new HashSet<>(nodeIds));
                String sql = "SELECT " + NODE_COLUMNS + " FROM graph_nodes WHERE profile_id = ? AND id IN ("
                    + placeholders(ids.size()) + ")";
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setString(1, profileId);
                    bindStrings(stmt, 2, ids);
                    return collectNodes(stmt);
                }
            });
        });
    }

    @Override
    public CompletableFuture<Optional<KnowledgeNode>> findNode(@NotNull String profileId, @NotNull EntityType type,
                                                               @NotNull String canonicalName) {
        return CompletableFuture.supplyAsync(() -> read("findNode", conn -> {
            String sql = "SELECT " + NODE_COLUMNS
                + " FROM graph_nodes WHERE profile_id = ? AND entity_type = ? AND canonical_name = ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                stmt.setString(2, type.name());
                stmt.setString(3, canonicalName);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(nodeFromResultSet(rs)) : Optional.<KnowledgeNode>empty();
                }
            }
        }));
    }

    @Override
    public CompletableFuture<List<KnowledgeNode>> findNodesByCanonicalNames(@NotNull String profileId,
                                                                            @NotNull Collection<String> canonicalNames) {
        return CompletableFuture.supplyAsync(() -> {
            ProfileIds.requireValid(profileId);
            if (canonicalNames.isEmpty()) {
                return List.<KnowledgeNode>of();
            }
            return read("findNodesByCanonicalNames", conn -> {
                List<String> names = List.copyOf(new HashSet<>(canonicalNames));
                String sql = "SELECT " + NODE_COLUMNS + " FROM graph_nodes WHERE profile_id = ? AND canonical_name IN ("
                    + placeholders(names.size()) + ")";
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setString(1, profileId);
                    bindStrings(stmt, 2, names);
                    return collectNodes(stmt);
                }
            });
        });
    }

    @Override
    public CompletableFuture<List<KnowledgeNode>> listNodes(@NotNull String profileId, @NotNull NodeFilter filter) {
        return CompletableFuture.supplyAsync(() -> read("listNodes", conn -> {
            StringBuilder sql = new StringBuilder("SELECT ").append(NODE_COLUMNS)
                .append(" FROM graph_nodes WHERE profile_id = ?");
            List<Object> params = new ArrayList<>();
            params.add(ProfileIds.requireValid(profileId));
            if (!filter.types().isEmpty()) {
                sql.append(" AND entity_type IN (").append(placeholders(filter.types().size())).append(')');
                filter.types().forEach(t -> params.add(t.name()));
            }
            if (!filter.canonicalNames().isEmpty()) {
                sql.append(" AND canonical_name IN (").append(placeholders(filter.canonicalNames().size())).append(')');
                params.addAll(filter.canonicalNames());
            }
            if (filter.mentionedSince() != null) {
                sql.append(" AND last_mentioned >= ?");
                params.add(filter.mentionedSince().toEpochMilli());
            }
            sql.append(switch (filter.order()) {
                case RECENCY -> " ORDER BY last_mentioned DESC, id";
                case SALIENCE -> " ORDER BY mention_count DESC, confidence DESC, id";
                case NAME -> " ORDER BY canonical_name, entity_type";
            });
            sql.append(" LIMIT ?");
            params.add(filter.limit());

            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                bindAll(stmt, params);
                return collectNodes(stmt);
            }
        }));
    }

    @Override
    public CompletableFuture<Boolean> deleteNode(@NotNull String profileId, @NotNull String nodeId) {
        return CompletableFuture.supplyAsync(() -> write("deleteNode", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM graph_nodes WHERE profile_id = ? AND id = ?")) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                stmt.setString(2, nodeId);
                boolean deleted = stmt.executeUpdate() > 0;
                LOG.debugf("Deleted node %s in profile %s: %s", nodeId, profileId, Boolean.valueOf(deleted));
                return deleted;
            }
        }));
    }

    // ========== Edges ==========

    @Override
    public CompletableFuture<KnowledgeEdge> upsertEdge(@NotNull KnowledgeEdge edge) {
        return CompletableFuture.supplyAsync(() -> write("upsertEdge", conn -> {
            ensureProfile(conn, ProfileIds.requireValid(edge.getProfileId()));
            requireEndpoints(conn, edge);
            return edge.getVersion() == 0 ? insertEdge(conn, edge) : updateEdge(conn, edge);
        }));
    }

    private void requireEndpoints(Connection conn, KnowledgeEdge edge) throws SQLException {
        Set<String> wanted = new HashSet<>(List.of(edge.getSourceNodeId(), edge.getTargetNodeId()));
        Set<String> found = new HashSet<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT id FROM graph_nodes WHERE profile_id = ? AND id IN (?, ?)")) {
            stmt.setString(1, edge.getProfileId());
            stmt.setString(2, edge.getSourceNodeId());
            stmt.setString(3, edge.getTargetNodeId());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    found.add(rs.getString(1));
                }
            }
        }
        wanted.removeAll(found);
        if (!wanted.isEmpty()) {
            throw new MissingEndpointException(edge.getProfileId(), wanted.iterator().next());
        }
    }

    private KnowledgeEdge insertEdge(Connection conn, KnowledgeEdge edge) throws SQLException {
        String sql = "INSERT INTO graph_edges (" + EDGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 1) "
            + "ON CONFLICT DO NOTHING";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, edge.getId());
            stmt.setString(2, edge.getProfileId());
            stmt.setString(3, edge.getSourceNodeId());
            stmt.setString(4, edge.getTargetNodeId());
            stmt.setString(5, edge.getRelationshipType());
            stmt.setDouble(6, edge.getConfidence());
            stmt.setInt(7, edge.getOccurrences());
            stmt.setLong(8, edge.getLastUpdated().toEpochMilli());
            stmt.setLong(9, edge.getCreatedAt().toEpochMilli());
            if (stmt.executeUpdate() == 0) {
                throw new StorageConflictException(edge.identityKey(), 0, "Edge already exists: " + edge.identityKey());
            }
        }
        LOG.debugf("Inserted edge %s", edge.identityKey());
        return edge.toBuilder().version(1).build();
    }

    private KnowledgeEdge updateEdge(Connection conn, KnowledgeEdge edge) throws SQLException {
        String sql = """
            UPDATE graph_edges SET
                confidence = ?, occurrences = ?, last_updated = ?, version = version + 1
            WHERE id = ? AND profile_id = ? AND source_node_id = ? AND target_node_id = ?
              AND relationship_type = ? AND version = ?
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setDouble(1, edge.getConfidence());
            stmt.setInt(2, edge.getOccurrences());
            stmt.setLong(3, edge.getLastUpdated().toEpochMilli());
            stmt.setString(4, edge.getId());
            stmt.setString(5, edge.getProfileId());
            stmt.setString(6, edge.getSourceNodeId());
            stmt.setString(7, edge.getTargetNodeId());
            stmt.setString(8, edge.getRelationshipType());
            stmt.setLong(9, edge.getVersion());
            if (stmt.executeUpdate() == 0) {
                throw new StorageConflictException(edge.identityKey(), edge.getVersion(),
                    "Edge " + edge.getId() + " changed or vanished (expected version " + edge.getVersion() + ")");
            }
        }
        return edge.toBuilder().version(edge.getVersion() + 1).build();
    }

    @Override
    public CompletableFuture<Optional<KnowledgeEdge>> findEdge(@NotNull String profileId, @NotNull String sourceNodeId,
                                                               @NotNull String targetNodeId, @NotNull String relationshipType) {
        return CompletableFuture.supplyAsync(() -> read("findEdge", conn -> {
            String sql = "SELECT " + EDGE_COLUMNS + " FROM graph_edges WHERE profile_id = ? "
                + "AND source_node_id = ? AND target_node_id = ? AND relationship_type = ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                stmt.setString(2, sourceNodeId);
                stmt.setString(3, targetNodeId);
                stmt.setString(4, relationshipType);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(edgeFromResultSet(rs)) : Optional.<KnowledgeEdge>empty();
                }
            }
        }));
    }

    @Override
    public CompletableFuture<List<KnowledgeEdge>> listEdges(@NotNull String profileId, @NotNull EdgeFilter filter) {
        return CompletableFuture.supplyAsync(() -> read("listEdges", conn -> {
            StringBuilder sql = new StringBuilder("SELECT ").append(EDGE_COLUMNS)
                .append(" FROM graph_edges WHERE profile_id = ?");
            List<Object> params = new ArrayList<>();
            params.add(ProfileIds.requireValid(profileId));
            if (!filter.nodeIds().isEmpty()) {
                String in = placeholders(filter.nodeIds().size());
                String joiner = filter.match() == EdgeFilter.EndpointMatch.BOTH ? " AND " : " OR ";
                sql.append(" AND (source_node_id IN (").append(in).append(')')
                    .append(joiner).append("target_node_id IN (").append(in).append("))");
                params.addAll(filter.nodeIds());
                params.addAll(filter.nodeIds());
            }
            if (!filter.relationshipTypes().isEmpty()) {
                sql.append(" AND relationship_type IN (").append(placeholders(filter.relationshipTypes().size())).append(')');
                params.addAll(filter.relationshipTypes());
            }
            sql.append(" ORDER BY last_updated DESC, id LIMIT ?");
            params.add(filter.limit());

            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                bindAll(stmt, params);
                List<KnowledgeEdge> edges = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        edges.add(edgeFromResultSet(rs));
                    }
                }
                return edges;
            }
        }));
    }

    // ========== Extraction logs ==========

    @Override
    public CompletableFuture<Void> appendExtractionLog(@NotNull ExtractionLogEntry entry) {
        return CompletableFuture.runAsync(() -> write("appendExtractionLog", conn -> {
            ensureProfile(conn, ProfileIds.requireValid(entry.profileId()));
            String sql = "INSERT INTO extraction_logs (" + LOG_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, entry.id());
                stmt.setString(2, entry.profileId());
                stmt.setString(3, entry.turnId());
                stmt.setString(4, entry.inputExcerpt());
                setNullableString(stmt, 5, entry.rawOutput());
                stmt.setString(6, toJson(entry.nodeIds()));
                stmt.setString(7, toJson(entry.edgeIds()));
                stmt.setString(8, entry.status().name());
                setNullableString(stmt, 9, entry.errorKind() != null ? entry.errorKind().name() : null);
                setNullableString(stmt, 10, entry.errorMessage());
                stmt.setString(11, toJson(entry.issues()));
                stmt.setLong(12, entry.durationMs());
                stmt.setLong(13, entry.createdAt().toEpochMilli());
                stmt.executeUpdate();
            }
            LOG.debugf("Appended %s extraction log for turn %s", entry.status(), entry.turnId());
            return null;
        }));
    }

    @Override
    public CompletableFuture<Optional<ExtractionLogEntry>> findSuccessfulLog(@NotNull String profileId, @NotNull String turnId) {
        return CompletableFuture.supplyAsync(() -> read("findSuccessfulLog", conn -> {
            String sql = "SELECT " + LOG_COLUMNS + " FROM extraction_logs "
                + "WHERE profile_id = ? AND turn_id = ? AND status = ? ORDER BY seq LIMIT 1";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                stmt.setString(2, turnId);
                stmt.setString(3, ExtractionStatus.SUCCEEDED.name());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(logFromResultSet(rs)) : Optional.<ExtractionLogEntry>empty();
                }
            }
        }));
    }

    @Override
    public CompletableFuture<List<ExtractionLogEntry>> listExtractionLogs(@NotNull String profileId, int limit) {
        return CompletableFuture.supplyAsync(() -> read("listExtractionLogs", conn -> {
            String sql = "SELECT " + LOG_COLUMNS + " FROM extraction_logs WHERE profile_id = ? ORDER BY seq DESC LIMIT ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, ProfileIds.requireValid(profileId));
                stmt.setInt(2, Math.max(1, limit));
                List<ExtractionLogEntry> entries = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(logFromResultSet(rs));
                    }
                }
                return entries;
            }
        }));
    }

    // ========== Relationship vocabulary ==========

    @Override
    public CompletableFuture<Boolean> addRelationshipType(@NotNull String term) {
        return CompletableFuture.supplyAsync(() -> write("addRelationshipType", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO relationship_types (term, added_at) VALUES (?, ?) ON CONFLICT(term) DO NOTHING")) {
                stmt.setString(1, term);
                stmt.setLong(2, Instant.now().toEpochMilli());
                return stmt.executeUpdate() > 0;
            }
        }));
    }

    @Override
    public CompletableFuture<List<String>> listRelationshipTypes() {
        return CompletableFuture.supplyAsync(() -> read("listRelationshipTypes", conn -> {
            List<String> terms = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT term FROM relationship_types ORDER BY rowid");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    terms.add(rs.getString(1));
                }
            }
            return terms;
        }));
    }

    // ========== Statistics ==========

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String profileId) {
        return CompletableFuture.supplyAsync(() -> read("getStats", conn -> {
            ProfileIds.requireValid(profileId);
            Map<EntityType, Long> byType = new EnumMap<>(EntityType.class);
            long nodeCount = 0;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT entity_type, COUNT(*) FROM graph_nodes WHERE profile_id = ? GROUP BY entity_type")) {
                stmt.setString(1, profileId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        long count = rs.getLong(2);
                        nodeCount += count;
                        EntityType.fromLabel(rs.getString(1)).ifPresent(t -> byType.put(t, count));
                    }
                }
            }
            Map<String, Long> byRelationship = new HashMap<>();
            long edgeCount = 0;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT relationship_type, COUNT(*) FROM graph_edges WHERE profile_id = ? GROUP BY relationship_type")) {
                stmt.setString(1, profileId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        edgeCount += rs.getLong(2);
                        byRelationship.put(rs.getString(1), rs.getLong(2));
                    }
                }
            }
            long runs = singleLong(conn, "SELECT COUNT(*) FROM extraction_logs WHERE profile_id = ?", profileId);
            long lastMentioned = singleLong(conn, "SELECT COALESCE(MAX(last_mentioned), -1) FROM graph_nodes WHERE profile_id = ?", profileId);
            return new GraphStats(profileId, nodeCount, edgeCount, byType, byRelationship, runs,
                lastMentioned >= 0 ? Instant.ofEpochMilli(lastMentioned) : null);
        }));
    }

    @Override
    public void close() {
        LOG.info("Closing SQLiteGraphStore");
    }

    // ========== Helpers ==========

    private <T> T write(String operation, SqlWork<T> work) {
        Connection conn = connectionManager.getWriteConnection();
        try {
            conn.setAutoCommit(false);
            T result = work.apply(conn);
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(conn);
            throw new GraphStorageException("SQLite " + operation + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            rollback(conn);
            throw e;
        } finally {
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                LOG.warn("Failed to reset auto-commit", e);
            }
            connectionManager.releaseWriteConnection(conn);
        }
    }

    private <T> T read(String operation, SqlWork<T> work) {
        Connection conn = connectionManager.getReadConnection();
        try {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new GraphStorageException("SQLite " + operation + " failed: " + e.getMessage(), e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            LOG.warn("Failed to rollback", rollbackEx);
        }
    }

    private static void ensureProfile(Connection conn, String profileId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO profiles (id, created_at) VALUES (?, ?) ON CONFLICT(id) DO NOTHING")) {
            stmt.setString(1, profileId);
            stmt.setLong(2, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static long singleLong(Connection conn, String sql, String profileId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, profileId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static void bindStrings(PreparedStatement stmt, int start, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            stmt.setString(start + i, values.get(i));
        }
    }

    private static void bindAll(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Long l) {
                stmt.setLong(i + 1, l);
            } else if (value instanceof Integer n) {
                stmt.setInt(i + 1, n);
            } else {
                stmt.setString(i + 1, (String) value);
            }
        }
    }

    private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private List<KnowledgeNode> collectNodes(PreparedStatement stmt) throws SQLException {
        List<KnowledgeNode> nodes = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                nodes.add(nodeFromResultSet(rs));
            }
        }
        return nodes;
    }

    private KnowledgeNode nodeFromResultSet(ResultSet rs) throws SQLException {
        EntityType type = EntityType.valueOf(rs.getString("entity_type"));
        return KnowledgeNode.builder()
            .id(rs.getString("id"))
            .profileId(rs.getString("profile_id"))
            .entityType(type)
            .entityName(rs.getString("entity_name"))
            .canonicalName(rs.getString("canonical_name"))
            .properties(NodeProperties.fromStored(type, fromJson(rs.getString("properties"), NodeProperties.class)))
            .confidence(rs.getDouble("confidence"))
            .mentionCount(rs.getInt("mention_count"))
            .lastMentioned(Instant.ofEpochMilli(rs.getLong("last_mentioned")))
            .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
            .version(rs.getLong("version"))
            .build();
    }

    private KnowledgeEdge edgeFromResultSet(ResultSet rs) throws SQLException {
        return KnowledgeEdge.builder()
            .id(rs.getString("id"))
            .profileId(rs.getString("profile_id"))
            .sourceNodeId(rs.getString("source_node_id"))
            .targetNodeId(rs.getString("target_node_id"))
            .relationshipType(rs.getString("relationship_type"))
            .confidence(rs.getDouble("confidence"))
            .occurrences(rs.getInt("occurrences"))
            .lastUpdated(Instant.ofEpochMilli(rs.getLong("last_updated")))
            .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
            .version(rs.getLong("version"))
            .build();
    }

    private ExtractionLogEntry logFromResultSet(ResultSet rs) throws SQLException {
        String errorKind = rs.getString("error_kind");
        return new ExtractionLogEntry(
            rs.getString("id"),
            rs.getString("profile_id"),
            rs.getString("turn_id"),
            rs.getString("input_excerpt"),
            rs.getString("raw_output"),
            fromJson(rs.getString("node_ids"), STRING_LIST_TYPE),
            fromJson(rs.getString("edge_ids"), STRING_LIST_TYPE),
            ExtractionStatus.valueOf(rs.getString("status")),
            errorKind != null ? ExtractionErrorKind.valueOf(errorKind) : null,
            rs.getString("error_message"),
            fromJson(rs.getString("issues"), ISSUE_LIST_TYPE),
            rs.getLong("duration_ms"),
            Instant.ofEpochMilli(rs.getLong("created_at"))
        );
    }

    private static String toJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GraphStorageException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new GraphStorageException("Failed to parse stored " + type.getSimpleName(), e);
        }
    }

    private static <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new GraphStorageException("Failed to parse stored list", e);
        }
    }
}
