package br.edu.ifba.mindgraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A relationship proposed by text understanding. Endpoints are mentions, not node ids;
 * the optional type hints narrow which node a mention refers to.
 */
public record RelationCandidate(
    @NotNull String source,
    @NotNull String target,
    @NotNull String type,
    double confidence,
    @Nullable EntityType sourceType,
    @Nullable EntityType targetType
) {

    public RelationCandidate {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    }

    public static RelationCandidate of(@NotNull String source, @NotNull String type, @NotNull String target,
                                       double confidence) {
        return new RelationCandidate(source, target, type, confidence, null, null);
    }
}
