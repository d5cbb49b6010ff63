package br.edu.ifba.mindgraph.utils;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for retried graph writes and outbound understanding calls.
 *
 * <p>MDC keys set while the event is logged:</p>
 * <ul>
 *   <li><code>retry.operation</code> - the operation being retried</li>
 *   <li><code>retry.attempt</code> - attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - exception class that triggered the retry</li>
 * </ul>
 *
 * <pre>
 * INFO  [RetryEventLogger] Retry attempt 2/2 for upsertNode(node::p1::PERSON::sarah): StorageConflictException - ...
 * WARN  [RetryEventLogger] Retry exhausted for upsertNode(node::p1::PERSON::sarah) after 2 attempts: ...
 * </pre>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    private static final String MDC_RETRY_OPERATION = "retry.operation";
    private static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    private static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs a retry that is about to happen.
     *
     * @param operation the operation being retried
     * @param attempt the attempt about to run (1-based)
     * @param maxAttempts the maximum number of attempts
     * @param failure the exception that triggered the retry (may be null)
     */
    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        try {
            putContext(operation, attempt, exceptionName);
            logger.info("Retry attempt {}/{} for {}: {} - {}",
                attempt, maxAttempts, operation, exceptionName, truncateMessage(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs that all attempts failed and the operation is abandoned.
     */
    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        try {
            putContext(operation, totalAttempts, exceptionName);
            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                operation, totalAttempts, exceptionName, truncateMessage(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs success; only attempts after the first are worth a line.
     */
    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            logger.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void putContext(final String operation, final int attempt, final String exceptionName) {
        MDC.put(MDC_RETRY_OPERATION, operation);
        MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
        MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    private String truncateMessage(final Throwable failure) {
        final String message = failure != null ? failure.getMessage() : null;
        if (message == null) {
            return "no message";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
