package br.edu.ifba.mindgraph.understanding;

import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of the understanding endpoints into exceptions that keep
 * the status and a bounded excerpt of the body. 4xx responses are not retried.
 */
public class UnderstandingClientExceptionMapper implements ResponseExceptionMapper<TextUnderstandingException> {

    private static final Logger LOG = Logger.getLogger(UnderstandingClientExceptionMapper.class);

    private static final int MAX_BODY_IN_MESSAGE = 500;

    @Override
    public TextUnderstandingException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to read error response body", e);
        }

        int status = response.getStatus();
        String statusInfo = response.getStatusInfo().getReasonPhrase();
        if (responseBody != null && responseBody.length() > MAX_BODY_IN_MESSAGE) {
            responseBody = responseBody.substring(0, MAX_BODY_IN_MESSAGE) + "...";
        }
        LOG.warnf("Understanding API error %d %s: %s", status, statusInfo,
            responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty body)");

        String message = String.format("Understanding API returned %d %s%s",
            status, statusInfo, responseBody != null ? " - " + responseBody : "");
        if (status < 500 && status != 408 && status != 429) {
            return new UnderstandingRejectedException(status, message);
        }
        return new TextUnderstandingException(message);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
