package br.edu.ifba.mindgraph.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ContextRequest(
    @NotNull(message = "message must not be null")
    @Size(max = 20000, message = "message must be at most 20000 characters")
    String message,

    @JsonProperty("max_nodes")
    @Min(value = 1, message = "max_nodes must be positive")
    Integer maxNodes
) {
}
