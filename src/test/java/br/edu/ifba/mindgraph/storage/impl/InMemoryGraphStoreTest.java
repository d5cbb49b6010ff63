package br.edu.ifba.mindgraph.storage.impl;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.storage.GraphStorageException;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.NodeFilter;
import br.edu.ifba.mindgraph.utils.Futures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs the store contract against {@link InMemoryGraphStore}.
 */
class InMemoryGraphStoreTest extends GraphStoreContractTest {

    @Override
    protected GraphStore createStore() {
        InMemoryGraphStore memory = new InMemoryGraphStore();
        memory.initialize().join();
        return memory;
    }

    @Test
    void testUninitializedStoreFails() {
        InMemoryGraphStore fresh = new InMemoryGraphStore();

        assertThrows(IllegalStateException.class,
            () -> Futures.await(fresh.listNodes(PROFILE, NodeFilter.all())));
    }

    @Test
    void testClosedStoreFails() {
        store.close();

        assertThrows(GraphStorageException.class,
            () -> Futures.await(store.upsertNode(node(PROFILE, EntityType.PERSON, "Sarah", 1, T0))));
    }
}
