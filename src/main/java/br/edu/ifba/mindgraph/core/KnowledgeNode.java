package br.edu.ifba.mindgraph.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

/**
 * A durable fact about the user: a person, emotion, activity, place or interest.
 *
 * <p>Identity within a profile is the pair ({@link #getEntityType()}, {@link #getCanonicalName()}).
 * Instances are immutable; updates go through {@link #toBuilder()}.</p>
 */
public final class KnowledgeNode {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("profile_id")
    @NotNull
    private final String profileId;

    @JsonProperty("entity_type")
    @NotNull
    private final EntityType entityType;

    @JsonProperty("entity_name")
    @NotNull
    private final String entityName;

    @JsonProperty("canonical_name")
    @NotNull
    private final String canonicalName;

    @JsonProperty("properties")
    @NotNull
    private final NodeProperties properties;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("mention_count")
    private final int mentionCount;

    @JsonProperty("last_mentioned")
    @NotNull
    private final Instant lastMentioned;

    @JsonProperty("created_at")
    @NotNull
    private final Instant createdAt;

    /**
     * Optimistic-concurrency version. Zero means "not persisted yet".
     */
    @JsonProperty("version")
    private final long version;

    private KnowledgeNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.profileId = Objects.requireNonNull(builder.profileId, "profileId must not be null");
        this.entityType = Objects.requireNonNull(builder.entityType, "entityType must not be null");
        this.entityName = Objects.requireNonNull(builder.entityName, "entityName must not be null");
        this.canonicalName = Objects.requireNonNull(builder.canonicalName, "canonicalName must not be null");
        this.properties = builder.properties != null ? builder.properties : NodeProperties.empty();
        this.lastMentioned = Objects.requireNonNull(builder.lastMentioned, "lastMentioned must not be null");
        this.createdAt = builder.createdAt != null ? builder.createdAt : builder.lastMentioned;
        if (builder.confidence < 0.0 || builder.confidence > 1.0 || Double.isNaN(builder.confidence)) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + builder.confidence);
        }
        if (builder.mentionCount < 1) {
            throw new IllegalArgumentException("mentionCount must be >= 1, got " + builder.mentionCount);
        }
        if (builder.version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        this.confidence = builder.confidence;
        this.mentionCount = builder.mentionCount;
        this.version = builder.version;
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getProfileId() {
        return profileId;
    }

    @NotNull
    public EntityType getEntityType() {
        return entityType;
    }

    @NotNull
    public String getEntityName() {
        return entityName;
    }

    @NotNull
    public String getCanonicalName() {
        return canonicalName;
    }

    @NotNull
    public NodeProperties getProperties() {
        return properties;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getMentionCount() {
        return mentionCount;
    }

    @NotNull
    public Instant getLastMentioned() {
        return lastMentioned;
    }

    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Key used for per-entity locking and uniqueness: profile, type and canonical name.
     */
    @NotNull
    public String identityKey() {
        return identityKey(profileId, entityType, canonicalName);
    }

    @NotNull
    public static String identityKey(@NotNull String profileId, @NotNull EntityType type, @NotNull String canonicalName) {
        return "node::" + profileId + "::" + type.name() + "::" + canonicalName;
    }

    @NotNull
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .profileId(profileId)
            .entityType(entityType)
            .entityName(entityName)
            .canonicalName(canonicalName)
            .properties(properties)
            .confidence(confidence)
            .mentionCount(mentionCount)
            .lastMentioned(lastMentioned)
            .createdAt(createdAt)
            .version(version);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        KnowledgeNode node = (KnowledgeNode) obj;
        return Double.compare(node.confidence, confidence) == 0 &&
               mentionCount == node.mentionCount &&
               version == node.version &&
               id.equals(node.id) &&
               profileId.equals(node.profileId) &&
               entityType == node.entityType &&
               entityName.equals(node.entityName) &&
               canonicalName.equals(node.canonicalName) &&
               properties.equals(node.properties) &&
               lastMentioned.equals(node.lastMentioned) &&
               createdAt.equals(node.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, profileId, entityType, entityName, canonicalName, properties,
            confidence, mentionCount, lastMentioned, createdAt, version);
    }

    @Override
    public String toString() {
        return "KnowledgeNode{" +
                "id='" + id + '\'' +
                ", profileId='" + profileId + '\'' +
                ", entityType=" + entityType +
                ", entityName='" + entityName + '\'' +
                ", canonicalName='" + canonicalName + '\'' +
                ", confidence=" + confidence +
                ", mentionCount=" + mentionCount +
                ", lastMentioned=" + lastMentioned +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for KnowledgeNode instances.
     */
    public static class Builder {
        private String id;
        private String profileId;
        private EntityType entityType;
        private String entityName;
        private String canonicalName;
        private NodeProperties properties;
        private double confidence = 0.5;
        private int mentionCount = 1;
        private Instant lastMentioned;
        private Instant createdAt;
        private long version;

        public Builder id(@NotNull String id) {
            this.id = id;
            return this;
        }

        public Builder profileId(@NotNull String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder entityType(@NotNull EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityName(@NotNull String entityName) {
            this.entityName = entityName;
            return this;
        }

        public Builder canonicalName(@NotNull String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder properties(NodeProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder mentionCount(int mentionCount) {
            this.mentionCount = mentionCount;
            return this;
        }

        public Builder lastMentioned(@NotNull Instant lastMentioned) {
            this.lastMentioned = lastMentioned;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public KnowledgeNode build() {
            return new KnowledgeNode(this);
        }
    }
}
