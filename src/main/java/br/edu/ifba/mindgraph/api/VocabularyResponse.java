package br.edu.ifba.mindgraph.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record VocabularyResponse(
    @JsonProperty("terms") List<String> terms,
    @JsonProperty("synonyms") Map<String, String> synonyms,
    @JsonProperty("extensible") boolean extensible
) {
}
