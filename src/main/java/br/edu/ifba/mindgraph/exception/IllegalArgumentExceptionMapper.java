package br.edu.ifba.mindgraph.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Invalid profile ids, unknown entity types, bad formats and similar caller errors.
 */
@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final IllegalArgumentException exception) {
        return Problems.of(Response.Status.BAD_REQUEST, exception.getMessage(), uriInfo);
    }
}
