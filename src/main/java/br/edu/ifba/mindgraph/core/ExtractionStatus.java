package br.edu.ifba.mindgraph.core;

/**
 * Outcome of one extraction run, as recorded in the extraction log.
 */
public enum ExtractionStatus {
    /** The run completed; individual candidates may still have been skipped. */
    SUCCEEDED,
    /** The run was abandoned before touching the graph. */
    FAILED,
    /** A successful run for the same turn already exists. */
    SKIPPED_DUPLICATE,
    /** The scheduler refused the run because the queue was full. */
    REJECTED
}
