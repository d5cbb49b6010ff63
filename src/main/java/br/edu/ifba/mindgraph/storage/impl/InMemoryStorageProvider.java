package br.edu.ifba.mindgraph.storage.impl;

import org.jboss.logging.Logger;

import br.edu.ifba.mindgraph.storage.GraphStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer for the in-memory graph store, active when
 * {@code mindgraph.storage.backend=memory}. Data does not survive a restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "mindgraph.storage.backend", stringValue = "memory")
public class InMemoryStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);

    private InMemoryGraphStore graphStore;

    @Produces
    @ApplicationScoped
    public GraphStore produceGraphStore() {
        if (graphStore == null) {
            graphStore = new InMemoryGraphStore();
            graphStore.initialize().join();
            LOG.info("Created InMemoryGraphStore instance");
        }
        return graphStore;
    }

    @PreDestroy
    void shutdown() {
        if (graphStore != null) {
            graphStore.close();
        }
    }
}
