package br.edu.ifba.mindgraph.core;

/**
 * Error taxonomy for extraction runs.
 *
 * <p>Run-level kinds fail the whole run; candidate-level kinds only skip a single
 * entity or relation.</p>
 */
public enum ExtractionErrorKind {

    EXTRACTION_UNAVAILABLE(true),
    MALFORMED_RESPONSE(true),
    RESOLUTION_AMBIGUOUS(false),
    INVALID_RELATION(false),
    STORAGE_CONFLICT(false),
    QUEUE_FULL(true),
    INTERNAL(true);

    private final boolean runLevel;

    ExtractionErrorKind(boolean runLevel) {
        this.runLevel = runLevel;
    }

    public boolean isRunLevel() {
        return runLevel;
    }
}
