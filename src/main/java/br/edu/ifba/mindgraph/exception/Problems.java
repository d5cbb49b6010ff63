package br.edu.ifba.mindgraph.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

final class Problems {

    static final String PROBLEM_JSON = "application/problem+json";

    private Problems() {
    }

    static Response of(Response.Status status, String detail, UriInfo uriInfo) {
        ErrorResponse error = new ErrorResponse(
            "about:blank",
            status.getReasonPhrase(),
            status.getStatusCode(),
            detail,
            uriInfo != null ? uriInfo.getPath() : null
        );
        return Response.status(status)
            .entity(error)
            .type(PROBLEM_JSON)
            .build();
    }
}
