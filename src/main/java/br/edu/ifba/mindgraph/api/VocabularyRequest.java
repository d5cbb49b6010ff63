package br.edu.ifba.mindgraph.api;

import jakarta.validation.constraints.NotBlank;

public record VocabularyRequest(
    @NotBlank(message = "term must not be blank")
    String term
) {
}
