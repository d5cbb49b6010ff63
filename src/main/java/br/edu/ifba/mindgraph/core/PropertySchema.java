package br.edu.ifba.mindgraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.EnumMap;
import java.util.Map;

/**
 * Versioned schema for the typed property bag of each {@link EntityType}.
 *
 * <p>Version history:</p>
 * <ul>
 *   <li>1 - initial keys for all five entity types</li>
 * </ul>
 *
 * <p>A property that is not declared for the node's type, or whose value has the
 * wrong kind, is rejected by {@link NodeProperties#of(EntityType, Map)}.</p>
 */
public final class PropertySchema {

    public static final int CURRENT_VERSION = 1;

    /**
     * Kinds of values a property may hold.
     */
    public enum ValueKind {
        STRING,
        NUMBER,
        BOOLEAN;

        /**
         * Checks whether a raw (JSON-decoded) value is of this kind.
         */
        public boolean accepts(@Nullable Object value) {
            return switch (this) {
                case STRING -> value instanceof String s && !s.isBlank();
                case NUMBER -> value instanceof Number;
                case BOOLEAN -> value instanceof Boolean;
            };
        }
    }

    private static final Map<EntityType, Map<String, ValueKind>> SCHEMAS = new EnumMap<>(EntityType.class);

    static {
        SCHEMAS.put(EntityType.PERSON, Map.of(
            "relationship", ValueKind.STRING,
            "pronoun", ValueKind.STRING,
            "note", ValueKind.STRING
        ));
        SCHEMAS.put(EntityType.EMOTION, Map.of(
            "intensity", ValueKind.NUMBER,
            "valence", ValueKind.STRING
        ));
        SCHEMAS.put(EntityType.ACTIVITY, Map.of(
            "frequency", ValueKind.STRING,
            "duration_minutes", ValueKind.NUMBER
        ));
        SCHEMAS.put(EntityType.PLACE, Map.of(
            "kind", ValueKind.STRING,
            "city", ValueKind.STRING
        ));
        SCHEMAS.put(EntityType.INTEREST, Map.of(
            "category", ValueKind.STRING,
            "since", ValueKind.STRING
        ));
    }

    private PropertySchema() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Returns the declared keys and kinds for a type.
     */
    @NotNull
    public static Map<String, ValueKind> keysFor(@NotNull EntityType type) {
        return SCHEMAS.getOrDefault(type, Map.of());
    }

    /**
     * Returns the kind declared for a key, or null when the key is not part of the schema.
     */
    @Nullable
    public static ValueKind kindOf(@NotNull EntityType type, @NotNull String key) {
        return keysFor(type).get(key);
    }
}
