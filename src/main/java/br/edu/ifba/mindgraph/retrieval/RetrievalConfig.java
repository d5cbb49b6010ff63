package br.edu.ifba.mindgraph.retrieval;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

import java.time.Duration;

/**
 * Configuration for context retrieval, read from {@code mindgraph.retrieval.*}.
 */
@ConfigMapping(prefix = "mindgraph.retrieval")
public interface RetrievalConfig {

    @WithName("default-max-nodes")
    @WithDefault("20")
    @Min(1)
    int defaultMaxNodes();

    /**
     * Upper bound applied to any requested {@code maxNodes}.
     */
    @WithName("max-nodes-limit")
    @WithDefault("50")
    @Min(1)
    int maxNodesLimit();

    /**
     * Deadline after which retrieval gives up and returns an empty window.
     */
    @WithDefault("250ms")
    Duration timeout();

    /**
     * Size of the most-recent and most-salient candidate pools.
     */
    @WithName("candidate-pool")
    @WithDefault("100")
    @Min(1)
    int candidatePool();

    @WithName("recency-half-life")
    @WithDefault("72h")
    Duration recencyHalfLife();

    Weights weights();

    interface Weights {

        @WithDefault("0.55")
        @DecimalMin("0.0")
        double lexical();

        @WithDefault("0.25")
        @DecimalMin("0.0")
        double recency();

        @WithDefault("0.20")
        @DecimalMin("0.0")
        double salience();
    }
}
