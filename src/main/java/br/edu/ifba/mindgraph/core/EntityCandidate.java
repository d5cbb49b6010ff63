package br.edu.ifba.mindgraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An entity proposed by text understanding, before resolution against the graph.
 *
 * @param type entity type
 * @param name surface form as it appeared in the text
 * @param span exact text span, when the service reports one
 * @param confidence extractor confidence in [0,1]
 * @param properties raw property values, validated later against {@link PropertySchema}
 */
public record EntityCandidate(
    @NotNull EntityType type,
    @NotNull String name,
    @Nullable String span,
    double confidence,
    @NotNull Map<String, Object> properties
) {

    public EntityCandidate {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        properties = properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : Map.of();
    }

    public static EntityCandidate of(@NotNull EntityType type, @NotNull String name, double confidence) {
        return new EntityCandidate(type, name, null, confidence, Map.of());
    }
}
