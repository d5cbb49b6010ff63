package br.edu.ifba.mindgraph.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Requests that conflict with the service's configuration, such as extending a
 * closed relationship vocabulary.
 */
@Provider
public class IllegalStateExceptionMapper implements ExceptionMapper<IllegalStateException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final IllegalStateException exception) {
        return Problems.of(Response.Status.CONFLICT, exception.getMessage(), uriInfo);
    }
}
