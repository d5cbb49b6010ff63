package br.edu.ifba.mindgraph.resolve;

/**
 * Blends the new observation into the stored value, then adds a small reinforcement
 * for the repeated evidence:
 *
 * <pre>
 * blended = (1 - alpha) * existing + alpha * observed
 * updated = blended + beta * (1 - blended)
 * </pre>
 *
 * <p>With beta &gt; 0 repeated observations at a constant confidence converge upward
 * toward 1, and a single low-confidence mention cannot erase a well-established fact.</p>
 */
public final class WeightedRecencyConfidencePolicy implements ConfidencePolicy {

    public static final String NAME = "weighted-recency";

    private final double alpha;
    private final double beta;

    public WeightedRecencyConfidencePolicy(double alpha, double beta) {
        if (alpha < 0.0 || alpha > 1.0 || beta < 0.0 || beta > 1.0) {
            throw new IllegalArgumentException("alpha and beta must be in [0,1], got " + alpha + ", " + beta);
        }
        this.alpha = alpha;
        this.beta = beta;
    }

    @Override
    public double update(double existing, double observed) {
        double blended = (1.0 - alpha) * ConfidencePolicy.clamp(existing) + alpha * ConfidencePolicy.clamp(observed);
        return ConfidencePolicy.clamp(blended + beta * (1.0 - blended));
    }

    @Override
    public String name() {
        return NAME;
    }
}
