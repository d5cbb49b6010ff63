package br.edu.ifba.mindgraph.export;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown exporter: one table of nodes per entity type, then a table of relationships.
 */
@ApplicationScoped
public class MarkdownGraphExporter implements GraphExporter {

    @Override
    public void export(
            @NotNull String profileId,
            @NotNull List<KnowledgeNode> nodes,
            @NotNull List<KnowledgeEdge> edges,
            @NotNull OutputStream outputStream) throws IOException {

        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        writer.write("# Knowledge Graph: " + escapeMarkdown(profileId));
        writer.newLine();
        writer.newLine();

        if (nodes.isEmpty()) {
            writer.write("_No facts recorded yet._");
            writer.newLine();
            writer.flush();
            return;
        }

        for (EntityType type : EntityType.values()) {
            List<KnowledgeNode> ofType = nodes.stream().filter(node -> node.getEntityType() == type).toList();
            if (ofType.isEmpty()) {
                continue;
            }
            writer.write("## " + type.label() + " (" + ofType.size() + ")");
            writer.newLine();
            writer.newLine();
            writer.write("| Name | Mentions | Confidence | Last mentioned |");
            writer.newLine();
            writer.write("|------|----------|------------|----------------|");
            writer.newLine();
            for (KnowledgeNode node : ofType) {
                writer.write("| " + escapeMarkdown(node.getEntityName())
                    + " | " + node.getMentionCount()
                    + " | " + String.format(Locale.ROOT, "%.2f", node.getConfidence())
                    + " | " + node.getLastMentioned()
                    + " |");
                writer.newLine();
            }
            writer.newLine();
        }

        if (!edges.isEmpty()) {
            Map<String, String> names = ExportSupport.namesById(nodes);
            writer.write("## Relationships (" + edges.size() + ")");
            writer.newLine();
            writer.newLine();
            writer.write("| Source | Relationship | Target | Occurrences | Confidence |");
            writer.newLine();
            writer.write("|--------|--------------|--------|-------------|------------|");
            writer.newLine();
            for (KnowledgeEdge edge : edges) {
                writer.write("| " + escapeMarkdown(names.getOrDefault(edge.getSourceNodeId(), edge.getSourceNodeId()))
                    + " | " + edge.getRelationshipType()
                    + " | " + escapeMarkdown(names.getOrDefault(edge.getTargetNodeId(), edge.getTargetNodeId()))
                    + " | " + edge.getOccurrences()
                    + " | " + String.format(Locale.ROOT, "%.2f", edge.getConfidence())
                    + " |");
                writer.newLine();
            }
        }
        writer.flush();
    }

    /**
     * Replaces pipes and newlines which would break table formatting.
     */
    static String escapeMarkdown(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text
            .replace("|", "\\|")
            .replace("\n", " ")
            .replace("\r", "");
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.MARKDOWN;
    }
}
