package br.edu.ifba.mindgraph.storage;

/**
 * Unexpected failure of the storage backend (I/O, SQL error, closed store).
 */
public class GraphStorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GraphStorageException(String message) {
        super(message);
    }

    public GraphStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
