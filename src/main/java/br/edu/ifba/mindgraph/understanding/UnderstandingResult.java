package br.edu.ifba.mindgraph.understanding;

import br.edu.ifba.mindgraph.core.EntityCandidate;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.RelationCandidate;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Validated text-understanding output.
 *
 * @param entities well-formed entity candidates
 * @param relations well-formed relation candidates
 * @param droppedItems items that were present but unusable
 */
public record UnderstandingResult(
    @NotNull List<EntityCandidate> entities,
    @NotNull List<RelationCandidate> relations,
    @NotNull List<ExtractionIssue> droppedItems
) {

    public UnderstandingResult {
        entities = List.copyOf(entities);
        relations = List.copyOf(relations);
        droppedItems = List.copyOf(droppedItems);
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relations.isEmpty();
    }
}
