package br.edu.ifba.mindgraph.resolve;

import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of resolving one batch of relation candidates.
 */
public record EdgeResolution(@NotNull List<KnowledgeEdge> edges, @NotNull List<ExtractionIssue> issues) {

    public EdgeResolution {
        edges = List.copyOf(edges);
        issues = List.copyOf(issues);
    }

    public static EdgeResolution empty() {
        return new EdgeResolution(List.of(), List.of());
    }
}
