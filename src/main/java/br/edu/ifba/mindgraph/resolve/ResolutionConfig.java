package br.edu.ifba.mindgraph.resolve;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

import java.util.Map;

/**
 * Configuration for entity and relation resolution, read from
 * {@code mindgraph.resolution.*}.
 */
@ConfigMapping(prefix = "mindgraph.resolution")
public interface ResolutionConfig {

    /**
     * Candidates below this confidence are dropped as ambiguous.
     * Default: 0.2
     */
    @WithName("min-confidence")
    @WithDefault("0.2")
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double minConfidence();

    /**
     * Alias to canonical name, applied after canonicalization.
     * Example: {@code mindgraph.resolution.aliases.mom=mother}
     */
    Map<String, String> aliases();

    /**
     * Confidence update policy group.
     */
    Confidence confidence();

    interface Confidence {

        /**
         * {@code weighted-recency} (default) or {@code max}.
         */
        @WithDefault("weighted-recency")
        String policy();

        /**
         * Weight of the new observation when blending.
         * Default: 0.4
         */
        @WithDefault("0.4")
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        double alpha();

        /**
         * Fraction of the remaining headroom added per re-observation.
         * Default: 0.05
         */
        @WithDefault("0.05")
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        double beta();
    }
}
