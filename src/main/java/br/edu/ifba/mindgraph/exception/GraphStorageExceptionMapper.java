package br.edu.ifba.mindgraph.exception;

import br.edu.ifba.mindgraph.storage.GraphStorageException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps unexpected storage failures to 503 Service Unavailable.
 */
@Provider
public class GraphStorageExceptionMapper implements ExceptionMapper<GraphStorageException> {

    private static final Logger LOG = Logger.getLogger(GraphStorageExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final GraphStorageException exception) {
        LOG.errorf(exception, "Storage failure on %s", uriInfo != null ? uriInfo.getPath() : "(unknown)");
        return Problems.of(Response.Status.SERVICE_UNAVAILABLE, "Graph storage is unavailable", uriInfo);
    }
}
