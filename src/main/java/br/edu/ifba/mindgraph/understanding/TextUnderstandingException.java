package br.edu.ifba.mindgraph.understanding;

/**
 * The text-understanding service is unreachable, timed out or answered with an error.
 */
public class TextUnderstandingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TextUnderstandingException(String message) {
        super(message);
    }

    public TextUnderstandingException(String message, Throwable cause) {
        super(message, cause);
    }
}
