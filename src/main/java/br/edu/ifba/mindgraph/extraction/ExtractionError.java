package br.edu.ifba.mindgraph.extraction;

import br.edu.ifba.mindgraph.core.ExtractionErrorKind;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Run-level failure of an extraction.
 */
public record ExtractionError(@NotNull ExtractionErrorKind kind, @NotNull String message) {

    public ExtractionError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message != null ? message : kind.name();
    }
}
