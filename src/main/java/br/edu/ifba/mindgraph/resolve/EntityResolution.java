package br.edu.ifba.mindgraph.resolve;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of resolving one batch of entity candidates.
 *
 * @param nodes nodes created or updated, one per distinct (type, canonical name)
 * @param nodesByCanonicalName resolved nodes indexed by canonical name; a name may map to
 *                             several nodes of different types
 * @param issues candidates that were skipped
 */
public record EntityResolution(
    @NotNull List<KnowledgeNode> nodes,
    @NotNull Map<String, List<KnowledgeNode>> nodesByCanonicalName,
    @NotNull List<ExtractionIssue> issues
) {

    public EntityResolution {
        nodes = List.copyOf(nodes);
        nodesByCanonicalName = Map.copyOf(nodesByCanonicalName);
        issues = List.copyOf(issues);
    }

    public static EntityResolution empty() {
        return new EntityResolution(List.of(), Map.of(), List.of());
    }

    public static EntityResolution of(@NotNull List<KnowledgeNode> nodes, @NotNull List<ExtractionIssue> issues) {
        Map<String, List<KnowledgeNode>> byName = nodes.stream()
            .collect(Collectors.groupingBy(KnowledgeNode::getCanonicalName, LinkedHashMap::new, Collectors.toList()));
        return new EntityResolution(nodes, byName, issues);
    }

    /**
     * Nodes from this batch with the given canonical name, narrowed by type when a hint is given.
     */
    @NotNull
    public List<KnowledgeNode> nodesFor(@NotNull String canonicalName, @Nullable EntityType typeHint) {
        List<KnowledgeNode> matches = nodesByCanonicalName.getOrDefault(canonicalName, List.of());
        if (typeHint == null) {
            return matches;
        }
        return matches.stream().filter(n -> n.getEntityType() == typeHint).toList();
    }
}
