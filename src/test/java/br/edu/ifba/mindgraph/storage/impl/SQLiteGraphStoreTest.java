package br.edu.ifba.mindgraph.storage.impl;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.resolve.RelationshipVocabulary;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.NodeFilter;
import br.edu.ifba.mindgraph.utils.Futures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the store contract against {@link SQLiteGraphStore} on a temporary database file.
 */
class SQLiteGraphStoreTest extends GraphStoreContractTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;

    @Override
    protected GraphStore createStore() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("graph.db").toString());
        try (Connection conn = connectionManager.createConnection()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        }
        SQLiteGraphStore sqlite = new SQLiteGraphStore(connectionManager);
        sqlite.initialize().join();
        return sqlite;
    }

    @Override
    protected void closeStore() throws Exception {
        store.close();
        connectionManager.close();
    }

    @Test
    void testDataSurvivesReopen() throws Exception {
        KnowledgeNode saved = Futures.await(store.upsertNode(node(PROFILE, EntityType.PLACE, "Home", 2, T0)));
        closeStore();

        connectionManager = new SQLiteConnectionManager(tempDir.resolve("graph.db").toString());
        store = new SQLiteGraphStore(connectionManager);

        assertEquals(saved, Futures.await(store.getNode(PROFILE, saved.getId())).get());
        assertEquals(1, Futures.await(store.listNodes(PROFILE, NodeFilter.all())).size());
    }

    @Test
    void testAddedRelationshipTypesSurviveReopen() throws Exception {
        RelationshipVocabulary vocabulary = new RelationshipVocabulary(List.of("enjoys"), Map.of(), true, store);
        assertTrue(vocabulary.add("Mentors"));
        closeStore();

        connectionManager = new SQLiteConnectionManager(tempDir.resolve("graph.db").toString());
        store = new SQLiteGraphStore(connectionManager);
        RelationshipVocabulary reloaded = new RelationshipVocabulary(List.of("enjoys"), Map.of(), true, store);

        assertTrue(reloaded.contains("mentors"));
        assertEquals(List.of("enjoys", "mentors"), reloaded.terms());
        assertFalse(reloaded.add("mentors"));
    }
}
