package br.edu.ifba.mindgraph.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the extraction scheduler's counters.
 */
public record ExtractionQueueStats(
    @JsonProperty("submitted") long submitted,
    @JsonProperty("completed") long completed,
    @JsonProperty("failed") long failed,
    @JsonProperty("rejected") long rejected,
    @JsonProperty("queued") int queued,
    @JsonProperty("active") int active,
    @JsonProperty("workers") int workers,
    @JsonProperty("queue_capacity") int queueCapacity
) {
}
