package br.edu.ifba.mindgraph.resolve;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the {@link ConfidencePolicy} named by {@code mindgraph.resolution.confidence.policy}.
 */
@ApplicationScoped
public class ConfidencePolicyProducer {

    private static final Logger logger = LoggerFactory.getLogger(ConfidencePolicyProducer.class);

    @Produces
    @ApplicationScoped
    ConfidencePolicy confidencePolicy(ResolutionConfig config) {
        ConfidencePolicy policy = fromConfig(config.confidence());
        logger.info("Using confidence policy '{}'", policy.name());
        return policy;
    }

    /**
     * @throws IllegalArgumentException for an unknown policy name
     */
    public static ConfidencePolicy fromConfig(ResolutionConfig.Confidence confidence) {
        String name = confidence.policy().trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case WeightedRecencyConfidencePolicy.NAME -> new WeightedRecencyConfidencePolicy(confidence.alpha(), confidence.beta());
            case MaxConfidencePolicy.NAME -> new MaxConfidencePolicy();
            default -> throw new IllegalArgumentException("Unknown confidence policy: " + confidence.policy());
        };
    }
}
