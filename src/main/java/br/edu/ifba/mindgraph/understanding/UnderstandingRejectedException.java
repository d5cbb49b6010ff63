package br.edu.ifba.mindgraph.understanding;

/**
 * The understanding service rejected the request with a 4xx status. Not retried.
 */
public class UnderstandingRejectedException extends TextUnderstandingException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public UnderstandingRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
