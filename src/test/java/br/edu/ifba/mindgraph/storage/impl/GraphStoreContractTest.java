package br.edu.ifba.mindgraph.storage.impl;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionErrorKind;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.core.NodeProperties;
import br.edu.ifba.mindgraph.shared.UuidUtils;
import br.edu.ifba.mindgraph.storage.EdgeFilter;
import br.edu.ifba.mindgraph.storage.GraphStats;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.MissingEndpointException;
import br.edu.ifba.mindgraph.storage.NodeFilter;
import br.edu.ifba.mindgraph.storage.NodeOrder;
import br.edu.ifba.mindgraph.storage.StorageConflictException;
import br.edu.ifba.mindgraph.utils.Futures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behavioral contract every {@link GraphStore} backend must satisfy.
 *
 * <p>Subclasses provide a fresh, initialized store per test; the same cases then
 * run against the in-memory and the SQLite backend.</p>
 */
public abstract class GraphStoreContractTest {

    protected static final String PROFILE = "profile-a";
    protected static final String OTHER_PROFILE = "profile-b";
    protected static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    protected GraphStore store;

    /**
     * Returns a new, initialized store with an empty schema.
     */
    protected abstract GraphStore createStore() throws Exception;

    protected void closeStore() throws Exception {
        store.close();
    }

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
    }

    @AfterEach
    void tearDownStore() throws Exception {
        closeStore();
    }

    protected static KnowledgeNode node(String profileId, EntityType type, String name, int mentions, Instant lastMentioned) {
        return KnowledgeNode.builder()
            .id(UuidUtils.newId())
            .profileId(profileId)
            .entityType(type)
            .entityName(name)
            .canonicalName(name.toLowerCase())
            .confidence(0.8)
            .mentionCount(mentions)
            .lastMentioned(lastMentioned)
            .createdAt(lastMentioned)
            .build();
    }

    protected static KnowledgeEdge edge(KnowledgeNode source, KnowledgeNode target, String type, Instant at) {
        return KnowledgeEdge.builder()
            .id(UuidUtils.newId())
            .profileId(source.getProfileId())
            .sourceNodeId(source.getId())
            .targetNodeId(target.getId())
            .relationshipType(type)
            .confidence(0.7)
            .lastUpdated(at)
            .build();
    }

    protected static ExtractionLogEntry log(String profileId, String turnId, ExtractionStatus status, Instant at) {
        ExtractionErrorKind kind = status == ExtractionStatus.FAILED ? ExtractionErrorKind.EXTRACTION_UNAVAILABLE : null;
        return new ExtractionLogEntry(UuidUtils.newId(), profileId, turnId, "text of " + turnId, "{}",
            List.of("n1"), List.of(), status, kind, kind != null ? "down" : null,
            List.of(ExtractionIssue.ambiguous("Mention 'x' matches no known entity")), 12L, at);
    }

    private KnowledgeNode save(KnowledgeNode node) {
        return Futures.await(store.upsertNode(node));
    }

    private KnowledgeEdge save(KnowledgeEdge edge) {
        return Futures.await(store.upsertEdge(edge));
    }

    @Nested
    @DisplayName("Nodes")
    class NodeContract {

        @Test
        @DisplayName("Inserted nodes read back with version 1 and all fields")
        void testInsertAndGet() {
            KnowledgeNode original = node(PROFILE, EntityType.ACTIVITY, "Yoga", 3, T0).toBuilder()
                .properties(NodeProperties.of(EntityType.ACTIVITY, Map.of("frequency", "weekly", "duration_minutes", 60)))
                .build();

            KnowledgeNode saved = save(original);
            Optional<KnowledgeNode> read = Futures.await(store.getNode(PROFILE, original.getId()));

            assertEquals(1, saved.getVersion());
            assertTrue(read.isPresent());
            assertEquals(saved, read.get());
            assertEquals(60.0, read.get().getProperties().getNumber("duration_minutes"));
        }

        @Test
        @DisplayName("A second insert of the same identity conflicts")
        void testDuplicateIdentityConflicts() {
            save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0));

            assertThrows(StorageConflictException.class,
                () -> save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0)));
        }

        @Test
        @DisplayName("Updates require the current version")
        void testVersionCheck() {
            KnowledgeNode v1 = save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0));

            KnowledgeNode v2 = save(v1.toBuilder().mentionCount(2).lastMentioned(T0.plusSeconds(60)).build());
            assertEquals(2, v2.getVersion());

            assertThrows(StorageConflictException.class,
                () -> save(v1.toBuilder().mentionCount(5).build()));
            assertEquals(2, Futures.await(store.getNode(PROFILE, v1.getId())).get().getMentionCount());
        }

        @Test
        @DisplayName("Lookup by identity and by canonical names across types")
        void testFindByCanonicalName() {
            save(node(PROFILE, EntityType.ACTIVITY, "running", 1, T0));
            save(node(PROFILE, EntityType.INTEREST, "running", 1, T0));
            save(node(PROFILE, EntityType.PLACE, "gym", 1, T0));

            assertTrue(Futures.await(store.findNode(PROFILE, EntityType.PLACE, "gym")).isPresent());
            assertTrue(Futures.await(store.findNode(PROFILE, EntityType.PERSON, "gym")).isEmpty());
            assertEquals(3, Futures.await(store.findNodesByCanonicalNames(PROFILE, List.of("running", "gym", "nothing"))).size());
        }

        @Test
        @DisplayName("Listing honors order, type filter, recency bound and limit")
        void testListNodes() {
            KnowledgeNode old = save(node(PROFILE, EntityType.PERSON, "Tom", 9, T0.minusSeconds(7200)));
            KnowledgeNode recent = save(node(PROFILE, EntityType.EMOTION, "calm", 1, T0));
            KnowledgeNode middle = save(node(PROFILE, EntityType.PERSON, "Sarah", 4, T0.minusSeconds(60)));

            List<KnowledgeNode> byRecency = Futures.await(store.listNodes(PROFILE, NodeFilter.mostRecent(10)));
            assertEquals(List.of(recent.getId(), middle.getId(), old.getId()),
                byRecency.stream().map(KnowledgeNode::getId).toList());

            List<KnowledgeNode> bySalience = Futures.await(store.listNodes(PROFILE, NodeFilter.mostSalient(2)));
            assertEquals(List.of(old.getId(), middle.getId()), bySalience.stream().map(KnowledgeNode::getId).toList());

            List<KnowledgeNode> people = Futures.await(store.listNodes(PROFILE,
                NodeFilter.all().withTypes(Set.of(EntityType.PERSON)).withOrder(NodeOrder.NAME)));
            assertEquals(List.of("sarah", "tom"), people.stream().map(KnowledgeNode::getCanonicalName).toList());

            List<KnowledgeNode> sinceOneHour = Futures.await(store.listNodes(PROFILE,
                NodeFilter.mostRecent(10).withMentionedSince(T0.minusSeconds(3600))));
            assertEquals(2, sinceOneHour.size());
        }

        @Test
        @DisplayName("Deleting a node removes its edges")
        void testDeleteNodeCascades() {
            KnowledgeNode sarah = save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0));
            KnowledgeNode happy = save(node(PROFILE, EntityType.EMOTION, "happy", 1, T0));
            KnowledgeNode park = save(node(PROFILE, EntityType.PLACE, "park", 1, T0));
            save(edge(sarah, happy, "experienced", T0));
            save(edge(happy, park, "associated_with", T0));

            assertTrue(Futures.await(store.deleteNode(PROFILE, happy.getId())));
            assertFalse(Futures.await(store.deleteNode(PROFILE, happy.getId())));

            assertTrue(Futures.await(store.listEdges(PROFILE, EdgeFilter.all())).isEmpty());
            assertEquals(2, Futures.await(store.listNodes(PROFILE, NodeFilter.all())).size());
        }
    }

    @Nested
    @DisplayName("Edges")
    class EdgeContract {

        @Test
        @DisplayName("Edges need both endpoints to exist")
        void testMissingEndpoint() {
            KnowledgeNode sarah = save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0));
            KnowledgeNode ghost = node(PROFILE, EntityType.EMOTION, "ghost", 1, T0);

            assertThrows(MissingEndpointException.class, () -> save(edge(sarah, ghost, "experienced", T0)));
        }

        @Test
        @DisplayName("Edge identity is unique and updates are versioned")
        void testEdgeVersioning() {
            KnowledgeNode work = save(node(PROFILE, EntityType.ACTIVITY, "work", 1, T0));
            KnowledgeNode stress = save(node(PROFILE, EntityType.EMOTION, "stress", 1, T0));
            KnowledgeEdge v1 = save(edge(work, stress, "causes", T0));

            assertThrows(StorageConflictException.class, () -> save(edge(work, stress, "causes", T0)));

            KnowledgeEdge v2 = save(v1.toBuilder().occurrences(2).lastUpdated(T0.plusSeconds(5)).build());
            assertEquals(2, v2.getVersion());
            assertThrows(StorageConflictException.class, () -> save(v1.toBuilder().occurrences(3).build()));

            KnowledgeEdge read = Futures.await(store.findEdge(PROFILE, work.getId(), stress.getId(), "causes")).get();
            assertEquals(2, read.getOccurrences());
            assertEquals(T0.plusSeconds(5), read.getLastUpdated());
            assertTrue(Futures.await(store.findEdge(PROFILE, stress.getId(), work.getId(), "causes")).isEmpty());
        }

        @Test
        @DisplayName("Edge listing by endpoints and relationship type")
        void testListEdges() {
            KnowledgeNode user = save(node(PROFILE, EntityType.PERSON, "user", 1, T0));
            KnowledgeNode yoga = save(node(PROFILE, EntityType.ACTIVITY, "yoga", 1, T0));
            KnowledgeNode calm = save(node(PROFILE, EntityType.EMOTION, "calm", 1, T0));
            save(edge(user, yoga, "enjoys", T0));
            save(edge(yoga, calm, "causes", T0.plusSeconds(1)));
            save(edge(user, calm, "experienced", T0.plusSeconds(2)));

            assertEquals(1, Futures.await(store.listEdges(PROFILE, EdgeFilter.between(List.of(user.getId(), yoga.getId())))).size());
            assertEquals(2, Futures.await(store.listEdges(PROFILE, EdgeFilter.touching(List.of(calm.getId())))).size());
            List<KnowledgeEdge> causes = Futures.await(store.listEdges(PROFILE,
                EdgeFilter.all().withRelationshipTypes(List.of("causes"))));
            assertEquals(1, causes.size());
            assertEquals("causes", causes.get(0).getRelationshipType());

            List<KnowledgeEdge> newest = Futures.await(store.listEdges(PROFILE, EdgeFilter.all().withLimit(1)));
            assertEquals("experienced", newest.get(0).getRelationshipType());
        }
    }

    @Nested
    @DisplayName("Extraction log")
    class LogContract {

        @Test
        @DisplayName("Entries are listed newest first and round-trip their fields")
        void testAppendAndList() {
            Futures.await(store.appendExtractionLog(log(PROFILE, "t1", ExtractionStatus.FAILED, T0)));
            Futures.await(store.appendExtractionLog(log(PROFILE, "t1", ExtractionStatus.SUCCEEDED, T0.plusSeconds(1))));
            Futures.await(store.appendExtractionLog(log(PROFILE, "t2", ExtractionStatus.SUCCEEDED, T0.plusSeconds(2))));

            List<ExtractionLogEntry> entries = Futures.await(store.listExtractionLogs(PROFILE, 2));

            assertEquals(2, entries.size());
            assertEquals("t2", entries.get(0).turnId());
            assertEquals("t1", entries.get(1).turnId());
            assertEquals(ExtractionStatus.SUCCEEDED, entries.get(1).status());
            assertEquals(List.of("n1"), entries.get(0).nodeIds());
            assertEquals(ExtractionErrorKind.RESOLUTION_AMBIGUOUS, entries.get(0).issues().get(0).kind());
        }

        @Test
        @DisplayName("Only SUCCEEDED entries mark a turn as processed")
        void testFindSuccessfulLog() {
            Futures.await(store.appendExtractionLog(log(PROFILE, "t1", ExtractionStatus.FAILED, T0)));
            assertTrue(Futures.await(store.findSuccessfulLog(PROFILE, "t1")).isEmpty());

            ExtractionLogEntry ok = log(PROFILE, "t1", ExtractionStatus.SUCCEEDED, T0.plusSeconds(1));
            Futures.await(store.appendExtractionLog(ok));
            assertEquals(ok.id(), Futures.await(store.findSuccessfulLog(PROFILE, "t1")).get().id());
            assertTrue(Futures.await(store.findSuccessfulLog(OTHER_PROFILE, "t1")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Relationship types")
    class RelationshipTypeContract {

        @Test
        @DisplayName("Added terms are listed once, oldest first")
        void testAddAndList() {
            assertTrue(Futures.await(store.listRelationshipTypes()).isEmpty());

            assertTrue(Futures.await(store.addRelationshipType("mentors")));
            assertTrue(Futures.await(store.addRelationshipType("coaches")));
            assertFalse(Futures.await(store.addRelationshipType("mentors")));

            assertEquals(List.of("mentors", "coaches"), Futures.await(store.listRelationshipTypes()));
        }

        @Test
        @DisplayName("Clearing a profile keeps the added terms")
        void testTermsOutliveProfiles() {
            Futures.await(store.upsertNode(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0)));
            Futures.await(store.addRelationshipType("mentors"));

            Futures.await(store.deleteProfileGraph(PROFILE));

            assertEquals(List.of("mentors"), Futures.await(store.listRelationshipTypes()));
        }
    }

    @Nested
    @DisplayName("Profiles")
    class ProfileContract {

        @Test
        @DisplayName("Profiles never see each other's data")
        void testIsolation() {
            KnowledgeNode a = save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0));
            save(node(OTHER_PROFILE, EntityType.PERSON, "Sarah", 1, T0));

            assertEquals(1, Futures.await(store.listNodes(PROFILE, NodeFilter.all())).size());
            assertTrue(Futures.await(store.getNode(OTHER_PROFILE, a.getId())).isEmpty());
            assertFalse(Futures.await(store.deleteNode(OTHER_PROFILE, a.getId())));
        }

        @Test
        @DisplayName("Deleting a profile graph removes nodes, edges and logs")
        void testDeleteProfileGraph() {
            KnowledgeNode a = save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0));
            KnowledgeNode b = save(node(PROFILE, EntityType.EMOTION, "happy", 1, T0));
            save(edge(a, b, "experienced", T0));
            Futures.await(store.appendExtractionLog(log(PROFILE, "t1", ExtractionStatus.SUCCEEDED, T0)));
            save(node(OTHER_PROFILE, EntityType.PERSON, "Tom", 1, T0));

            Futures.await(store.deleteProfileGraph(PROFILE));

            assertFalse(Futures.await(store.profileGraphExists(PROFILE)));
            assertEquals(0, Futures.await(store.getStats(PROFILE)).nodeCount());
            assertTrue(Futures.await(store.listExtractionLogs(PROFILE, 10)).isEmpty());
            assertEquals(1, Futures.await(store.getStats(OTHER_PROFILE)).nodeCount());
        }

        @Test
        @DisplayName("Profiles are registered on first write or explicitly")
        void testProfileRegistration() {
            assertFalse(Futures.await(store.profileGraphExists(PROFILE)));
            Futures.await(store.createProfileGraph(PROFILE));
            assertTrue(Futures.await(store.profileGraphExists(PROFILE)));

            save(node(OTHER_PROFILE, EntityType.PLACE, "home", 1, T0));
            assertTrue(Futures.await(store.profileGraphExists(OTHER_PROFILE)));
        }

        @Test
        @DisplayName("Invalid profile ids are rejected")
        void testInvalidProfileId() {
            assertThrows(IllegalArgumentException.class,
                () -> Futures.await(store.listNodes("../etc", NodeFilter.all())));
        }

        @Test
        @DisplayName("Stats count nodes by type, edges by relationship and runs")
        void testStats() {
            KnowledgeNode a = save(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0.minusSeconds(30)));
            KnowledgeNode b = save(node(PROFILE, EntityType.EMOTION, "happy", 1, T0));
            KnowledgeNode c = save(node(PROFILE, EntityType.EMOTION, "calm", 1, T0.minusSeconds(10)));
            save(edge(a, b, "experienced", T0));
            save(edge(a, c, "experienced", T0));
            Futures.await(store.appendExtractionLog(log(PROFILE, "t1", ExtractionStatus.SUCCEEDED, T0)));

            GraphStats stats = Futures.await(store.getStats(PROFILE));

            assertEquals(3, stats.nodeCount());
            assertEquals(2, stats.edgeCount());
            assertEquals(2L, stats.nodesByType().get(EntityType.EMOTION));
            assertEquals(2L, stats.edgesByRelationship().get("experienced"));
            assertEquals(1, stats.extractionRuns());
            assertEquals(T0, stats.lastMentioned());
        }

        @Test
        @DisplayName("Stats of an unknown profile are empty")
        void testStatsOfUnknownProfile() {
            GraphStats stats = Futures.await(store.getStats("nobody"));

            assertEquals(0, stats.nodeCount());
            assertNull(stats.lastMentioned());
        }
    }
}
