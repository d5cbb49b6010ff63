package br.edu.ifba.mindgraph.storage;

/**
 * Sort orders supported by {@link GraphStore#listNodes}. Each one is backed by an index.
 */
public enum NodeOrder {
    /** Most recently mentioned first. */
    RECENCY,
    /** Highest mention count first, then highest confidence. */
    SALIENCE,
    /** Canonical name, ascending. */
    NAME
}
