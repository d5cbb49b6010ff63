package br.edu.ifba.mindgraph.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TurnAcceptedResponse(
    @JsonProperty("turn_id") String turnId,
    @JsonProperty("status") String status
) {
}
