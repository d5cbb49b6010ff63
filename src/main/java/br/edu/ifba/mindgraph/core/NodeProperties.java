package br.edu.ifba.mindgraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed attribute bag attached to a {@link KnowledgeNode}.
 *
 * <p>Values are validated against {@link PropertySchema} for the node's type.
 * Only strings, numbers (stored as {@code Double}) and booleans survive validation.</p>
 */
public final class NodeProperties {

    private static final Logger logger = LoggerFactory.getLogger(NodeProperties.class);

    private static final NodeProperties EMPTY = new NodeProperties(PropertySchema.CURRENT_VERSION, Map.of());

    @JsonProperty("schemaVersion")
    private final int schemaVersion;

    @JsonProperty("values")
    @NotNull
    private final Map<String, Object> values;

    @JsonCreator
    NodeProperties(
            @JsonProperty("schemaVersion") int schemaVersion,
            @JsonProperty("values") @Nullable Map<String, Object> values) {
        this.schemaVersion = schemaVersion;
        this.values = values != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
            : Map.of();
    }

    @NotNull
    public static NodeProperties empty() {
        return EMPTY;
    }

    /**
     * Validates raw key/value pairs against the schema of {@code type}.
     * Undeclared keys and values of the wrong kind are dropped.
     *
     * @param type the owning node's type
     * @param raw raw values, typically decoded from JSON (may be null)
     * @return validated properties
     */
    @NotNull
    public static NodeProperties of(@NotNull EntityType type, @Nullable Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            PropertySchema.ValueKind kind = key != null ? PropertySchema.kindOf(type, key) : null;
            if (kind == null || !kind.accepts(value)) {
                logger.debug("Dropping property '{}' for type {}: not in schema v{} or wrong kind",
                    key, type, PropertySchema.CURRENT_VERSION);
                continue;
            }
            accepted.put(key, normalize(value));
        }
        return accepted.isEmpty() ? EMPTY : new NodeProperties(PropertySchema.CURRENT_VERSION, accepted);
    }

    /**
     * Re-validates properties read back from storage, which may have been written
     * under an older schema version. JSON decoding also yields integers, so values
     * are normalized again.
     */
    @NotNull
    public static NodeProperties fromStored(@NotNull EntityType type, @Nullable NodeProperties stored) {
        if (stored == null) {
            return EMPTY;
        }
        if (stored.schemaVersion > PropertySchema.CURRENT_VERSION) {
            logger.warn("Stored properties use schema v{} newer than v{}; unknown keys will be dropped",
                stored.schemaVersion, PropertySchema.CURRENT_VERSION);
        }
        return of(type, stored.values);
    }

    private static Object normalize(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s) {
            return s.trim();
        }
        return value;
    }

    /**
     * Returns a new bag where values from {@code newer} override this one.
     */
    @NotNull
    public NodeProperties mergedWith(@NotNull NodeProperties newer) {
        if (newer.values.isEmpty()) {
            return this;
        }
        if (values.isEmpty()) {
            return newer;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(newer.values);
        return new NodeProperties(PropertySchema.CURRENT_VERSION, merged);
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    @NotNull
    public Map<String, Object> getValues() {
        return values;
    }

    @Nullable
    public String getString(@NotNull String key) {
        Object value = values.get(key);
        return value instanceof String s ? s : null;
    }

    @Nullable
    public Double getNumber(@NotNull String key) {
        Object value = values.get(key);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        NodeProperties that = (NodeProperties) obj;
        return schemaVersion == that.schemaVersion && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaVersion, values);
    }

    @Override
    public String toString() {
        return "NodeProperties{v" + schemaVersion + ", " + values + '}';
    }
}
