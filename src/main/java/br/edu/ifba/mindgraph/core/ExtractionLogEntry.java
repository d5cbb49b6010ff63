package br.edu.ifba.mindgraph.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Append-only audit record of one extraction run.
 *
 * <p>Entries are never mutated after being appended. A SUCCEEDED entry for a
 * (profile, turn) pair marks the turn as processed.</p>
 *
 * @param id entry UUID
 * @param profileId owning profile
 * @param turnId the conversation turn the run processed
 * @param inputExcerpt leading part of the turn text
 * @param rawOutput raw text-understanding response, truncated (null when the call failed)
 * @param nodeIds ids of nodes created or updated by the run
 * @param edgeIds ids of edges created or updated by the run
 * @param status run outcome
 * @param errorKind run-level error kind for FAILED/REJECTED runs
 * @param errorMessage run-level error message
 * @param issues candidate-level problems
 * @param durationMs wall-clock duration of the run
 * @param createdAt when the entry was appended
 */
public record ExtractionLogEntry(
    @JsonProperty("id") @NotNull String id,
    @JsonProperty("profile_id") @NotNull String profileId,
    @JsonProperty("turn_id") @NotNull String turnId,
    @JsonProperty("input_excerpt") @NotNull String inputExcerpt,
    @JsonProperty("raw_output") @Nullable String rawOutput,
    @JsonProperty("node_ids") @NotNull List<String> nodeIds,
    @JsonProperty("edge_ids") @NotNull List<String> edgeIds,
    @JsonProperty("status") @NotNull ExtractionStatus status,
    @JsonProperty("error_kind") @Nullable ExtractionErrorKind errorKind,
    @JsonProperty("error_message") @Nullable String errorMessage,
    @JsonProperty("issues") @NotNull List<ExtractionIssue> issues,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("created_at") @NotNull Instant createdAt
) {

    public static final int MAX_EXCERPT_LENGTH = 500;
    public static final int MAX_RAW_OUTPUT_LENGTH = 16 * 1024;

    public ExtractionLogEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(profileId, "profileId must not be null");
        Objects.requireNonNull(turnId, "turnId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        inputExcerpt = truncate(inputExcerpt != null ? inputExcerpt : "", MAX_EXCERPT_LENGTH);
        rawOutput = rawOutput != null ? truncate(rawOutput, MAX_RAW_OUTPUT_LENGTH) : null;
        nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
        edgeIds = edgeIds != null ? List.copyOf(edgeIds) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
        if (status == ExtractionStatus.FAILED && errorKind == null) {
            throw new IllegalArgumentException("FAILED entries must carry an errorKind");
        }
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == ExtractionStatus.SUCCEEDED;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
