package br.edu.ifba.mindgraph.storage;

/**
 * Thrown when a compare-and-swap write finds a different version than expected:
 * the row was created, changed or deleted by a concurrent writer.
 */
public class StorageConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final long expectedVersion;

    public StorageConflictException(String key, long expectedVersion, String message) {
        super(message);
        this.key = key;
        this.expectedVersion = expectedVersion;
    }

    public String getKey() {
        return key;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
