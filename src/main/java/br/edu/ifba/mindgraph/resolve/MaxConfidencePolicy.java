package br.edu.ifba.mindgraph.resolve;

/**
 * Keeps the highest confidence ever observed.
 */
public final class MaxConfidencePolicy implements ConfidencePolicy {

    public static final String NAME = "max";

    @Override
    public double update(double existing, double observed) {
        return ConfidencePolicy.clamp(Math.max(existing, observed));
    }

    @Override
    public String name() {
        return NAME;
    }
}
