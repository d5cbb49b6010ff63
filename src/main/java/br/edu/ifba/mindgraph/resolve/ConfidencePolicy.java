package br.edu.ifba.mindgraph.resolve;

/**
 * How the confidence of an existing node or edge changes when it is observed again.
 */
public interface ConfidencePolicy {

    /**
     * @param existing stored confidence in [0,1]
     * @param observed confidence of the new observation in [0,1]
     * @return updated confidence in [0,1]
     */
    double update(double existing, double observed);

    String name();

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
