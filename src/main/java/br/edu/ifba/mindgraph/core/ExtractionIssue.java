package br.edu.ifba.mindgraph.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A candidate-level problem encountered during an extraction run.
 *
 * @param kind the error kind
 * @param detail human-readable description, e.g. the offending mention
 */
public record ExtractionIssue(
    @JsonProperty("kind") @NotNull ExtractionErrorKind kind,
    @JsonProperty("detail") @NotNull String detail
) {

    public ExtractionIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
    }

    public static ExtractionIssue ambiguous(@NotNull String detail) {
        return new ExtractionIssue(ExtractionErrorKind.RESOLUTION_AMBIGUOUS, detail);
    }

    public static ExtractionIssue invalidRelation(@NotNull String detail) {
        return new ExtractionIssue(ExtractionErrorKind.INVALID_RELATION, detail);
    }

    public static ExtractionIssue storageConflict(@NotNull String detail) {
        return new ExtractionIssue(ExtractionErrorKind.STORAGE_CONFLICT, detail);
    }
}
