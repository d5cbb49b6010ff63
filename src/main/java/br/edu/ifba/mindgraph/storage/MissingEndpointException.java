package br.edu.ifba.mindgraph.storage;

/**
 * Thrown when an edge write references a node that does not exist in the profile,
 * typically because it was deleted after the relation was resolved.
 */
public class MissingEndpointException extends GraphStorageException {

    private static final long serialVersionUID = 1L;

    public MissingEndpointException(String profileId, String nodeId) {
        super("Node " + nodeId + " does not exist in profile " + profileId);
    }
}
