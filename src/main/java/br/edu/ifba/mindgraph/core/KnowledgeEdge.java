package br.edu.ifba.mindgraph.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

/**
 * Directed relationship between two nodes of the same profile.
 * Unique per (profile, source, target, relationship type).
 */
public final class KnowledgeEdge {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("profile_id")
    @NotNull
    private final String profileId;

    @JsonProperty("source_node_id")
    @NotNull
    private final String sourceNodeId;

    @JsonProperty("target_node_id")
    @NotNull
    private final String targetNodeId;

    @JsonProperty("relationship_type")
    @NotNull
    private final String relationshipType;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("occurrences")
    private final int occurrences;

    @JsonProperty("last_updated")
    @NotNull
    private final Instant lastUpdated;

    @JsonProperty("created_at")
    @NotNull
    private final Instant createdAt;

    @JsonProperty("version")
    private final long version;

    private KnowledgeEdge(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.profileId = Objects.requireNonNull(builder.profileId, "profileId must not be null");
        this.sourceNodeId = Objects.requireNonNull(builder.sourceNodeId, "sourceNodeId must not be null");
        this.targetNodeId = Objects.requireNonNull(builder.targetNodeId, "targetNodeId must not be null");
        this.relationshipType = Objects.requireNonNull(builder.relationshipType, "relationshipType must not be null");
        this.lastUpdated = Objects.requireNonNull(builder.lastUpdated, "lastUpdated must not be null");
        this.createdAt = builder.createdAt != null ? builder.createdAt : builder.lastUpdated;
        if (builder.confidence < 0.0 || builder.confidence > 1.0 || Double.isNaN(builder.confidence)) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + builder.confidence);
        }
        if (builder.occurrences < 1) {
            throw new IllegalArgumentException("occurrences must be >= 1, got " + builder.occurrences);
        }
        this.confidence = builder.confidence;
        this.occurrences = builder.occurrences;
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
    public String getSourceNodeId() {
        return sourceNodeId;
    }

    @NotNull
    public String getTargetNodeId() {
        return targetNodeId;
    }

    @NotNull
    public String getRelationshipType() {
        return relationshipType;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getOccurrences() {
        return occurrences;
    }

    @NotNull
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Returns true when either endpoint is the given node.
     */
    public boolean touches(@NotNull String nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    @NotNull
    public String identityKey() {
        return identityKey(profileId, sourceNodeId, targetNodeId, relationshipType);
    }

    @NotNull
    public static String identityKey(@NotNull String profileId, @NotNull String sourceNodeId,
                                     @NotNull String targetNodeId, @NotNull String relationshipType) {
        return "edge::" + profileId + "::" + sourceNodeId + "::" + targetNodeId + "::" + relationshipType;
    }

    @NotNull
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .profileId(profileId)
            .sourceNodeId(sourceNodeId)
            .targetNodeId(targetNodeId)
            .relationshipType(relationshipType)
            .confidence(confidence)
            .occurrences(occurrences)
            .lastUpdated(lastUpdated)
            .createdAt(createdAt)
            .version(version);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        KnowledgeEdge edge = (KnowledgeEdge) obj;
        return Double.compare(edge.confidence, confidence) == 0 &&
               occurrences == edge.occurrences &&
               version == edge.version &&
               id.equals(edge.id) &&
               profileId.equals(edge.profileId) &&
               sourceNodeId.equals(edge.sourceNodeId) &&
               targetNodeId.equals(edge.targetNodeId) &&
               relationshipType.equals(edge.relationshipType) &&
               lastUpdated.equals(edge.lastUpdated) &&
               createdAt.equals(edge.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, profileId, sourceNodeId, targetNodeId, relationshipType,
            confidence, occurrences, lastUpdated, createdAt, version);
    }

    @Override
    public String toString() {
        return "KnowledgeEdge{" +
                "id='" + id + '\'' +
                ", " + sourceNodeId + " -[" + relationshipType + "]-> " + targetNodeId +
                ", confidence=" + confidence +
                ", occurrences=" + occurrences +
                ", lastUpdated=" + lastUpdated +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for KnowledgeEdge instances.
     */
    public static class Builder {
        private String id;
        private String profileId;
        private String sourceNodeId;
        private String targetNodeId;
        private String relationshipType;
        private double confidence = 0.5;
        private int occurrences = 1;
        private Instant lastUpdated;
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

        public Builder sourceNodeId(@NotNull String sourceNodeId) {
            this.sourceNodeId = sourceNodeId;
            return this;
        }

        public Builder targetNodeId(@NotNull String targetNodeId) {
            this.targetNodeId = targetNodeId;
            return this;
        }

        public Builder relationshipType(@NotNull String relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder occurrences(int occurrences) {
            this.occurrences = occurrences;
            return this;
        }

        public Builder lastUpdated(@NotNull Instant lastUpdated) {
            this.lastUpdated = lastUpdated;
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

        public KnowledgeEdge build() {
            return new KnowledgeEdge(this);
        }
    }
}
