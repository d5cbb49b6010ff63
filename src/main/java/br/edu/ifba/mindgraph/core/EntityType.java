package br.edu.ifba.mindgraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Kinds of durable facts the graph keeps about a user.
 *
 * <p>The set is closed at compile time. New kinds are added here together with
 * their {@link PropertySchema} entry.</p>
 */
public enum EntityType {

    PERSON("Person"),
    EMOTION("Emotion"),
    ACTIVITY("Activity"),
    PLACE("Place"),
    INTEREST("Interest");

    /**
     * Labels that extraction services commonly emit for our types.
     */
    private static final Map<String, EntityType> SYNONYMS = Map.ofEntries(
        Map.entry("people", PERSON),
        Map.entry("human", PERSON),
        Map.entry("friend", PERSON),
        Map.entry("family", PERSON),
        Map.entry("feeling", EMOTION),
        Map.entry("feelings", EMOTION),
        Map.entry("mood", EMOTION),
        Map.entry("emotions", EMOTION),
        Map.entry("event", ACTIVITY),
        Map.entry("habit", ACTIVITY),
        Map.entry("task", ACTIVITY),
        Map.entry("activities", ACTIVITY),
        Map.entry("location", PLACE),
        Map.entry("venue", PLACE),
        Map.entry("places", PLACE),
        Map.entry("hobby", INTEREST),
        Map.entry("topic", INTEREST),
        Map.entry("interests", INTEREST)
    );

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    /**
     * Display label, e.g. {@code "Person"}.
     */
    @NotNull
    public String label() {
        return label;
    }

    /**
     * Parses a type label leniently: enum names, display labels and common synonyms
     * are accepted regardless of case.
     *
     * @param value raw label, may be null
     * @return the matching type, or empty when the label is unknown
     */
    @NotNull
    public static Optional<EntityType> fromLabel(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(SYNONYMS.get(normalized));
    }
}
