package br.edu.ifba.mindgraph.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * RFC 7807 problem details body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance
) {
}
