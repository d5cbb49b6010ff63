package br.edu.ifba.mindgraph.understanding;

/**
 * The text-understanding response could not be parsed into entities and relations.
 */
public class MalformedUnderstandingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedUnderstandingException(String message) {
        super(message);
    }

    public MalformedUnderstandingException(String message, Throwable cause) {
        super(message, cause);
    }
}
