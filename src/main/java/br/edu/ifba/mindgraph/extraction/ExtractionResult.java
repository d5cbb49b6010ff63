package br.edu.ifba.mindgraph.extraction;

import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one extraction run. Failed runs carry an {@link ExtractionError}
 * instead of throwing.
 */
public record ExtractionResult(
    @NotNull String turnId,
    @NotNull ExtractionStatus status,
    @NotNull List<KnowledgeNode> nodes,
    @NotNull List<KnowledgeEdge> edges,
    @NotNull List<ExtractionIssue> issues,
    @Nullable ExtractionError error,
    long durationMs
) {

    public ExtractionResult {
        Objects.requireNonNull(turnId, "turnId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static ExtractionResult succeeded(String turnId, List<KnowledgeNode> nodes, List<KnowledgeEdge> edges,
                                             List<ExtractionIssue> issues, long durationMs) {
        return new ExtractionResult(turnId, ExtractionStatus.SUCCEEDED, nodes, edges, issues, null, durationMs);
    }

    public static ExtractionResult skipped(String turnId, long durationMs) {
        return new ExtractionResult(turnId, ExtractionStatus.SKIPPED_DUPLICATE, null, null, null, null, durationMs);
    }

    public static ExtractionResult failed(String turnId, ExtractionError error, long durationMs) {
        return new ExtractionResult(turnId, ExtractionStatus.FAILED, null, null, null, error, durationMs);
    }

    public static ExtractionResult rejected(String turnId, ExtractionError error) {
        return new ExtractionResult(turnId, ExtractionStatus.REJECTED, null, null, null, error, 0L);
    }

    public boolean isSuccess() {
        return status == ExtractionStatus.SUCCEEDED;
    }
}
