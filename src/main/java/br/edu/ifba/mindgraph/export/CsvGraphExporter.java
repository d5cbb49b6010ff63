package br.edu.ifba.mindgraph.export;

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
import java.util.stream.Collectors;

/**
 * CSV exporter with a nodes section and an edges section.
 *
 * <pre>
 * # NODES
 * id,entity_type,entity_name,canonical_name,confidence,mention_count,last_mentioned,properties
 * 0190...,PERSON,Sarah,sarah,0.90,5,2024-05-01T10:00:00Z,relationship=friend
 *
 * # EDGES
 * id,source,target,relationship_type,confidence,occurrences,last_updated
 * 0190...,Sarah,happy,experienced,0.80,1,2024-05-01T10:00:00Z
 * </pre>
 */
@ApplicationScoped
public class CsvGraphExporter implements GraphExporter {

    private static final String NODE_HEADER =
        "id,entity_type,entity_name,canonical_name,confidence,mention_count,last_mentioned,properties";
    private static final String EDGE_HEADER =
        "id,source,target,relationship_type,confidence,occurrences,last_updated";

    @Override
    public void export(
            @NotNull String profileId,
            @NotNull List<KnowledgeNode> nodes,
            @NotNull List<KnowledgeEdge> edges,
            @NotNull OutputStream outputStream) throws IOException {

        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        writer.write("# NODES");
        writer.newLine();
        writer.write(NODE_HEADER);
        writer.newLine();
        for (KnowledgeNode node : nodes) {
            writer.write(String.join(",",
                node.getId(),
                node.getEntityType().name(),
                escapeCsv(node.getEntityName()),
                escapeCsv(node.getCanonicalName()),
                String.format(Locale.ROOT, "%.2f", node.getConfidence()),
                String.valueOf(node.getMentionCount()),
                node.getLastMentioned().toString(),
                escapeCsv(formatProperties(node.getProperties().getValues()))));
            writer.newLine();
        }

        writer.newLine();
        writer.write("# EDGES");
        writer.newLine();
        writer.write(EDGE_HEADER);
        writer.newLine();
        Map<String, String> names = ExportSupport.namesById(nodes);
        for (KnowledgeEdge edge : edges) {
            writer.write(String.join(",",
                edge.getId(),
                escapeCsv(names.getOrDefault(edge.getSourceNodeId(), edge.getSourceNodeId())),
                escapeCsv(names.getOrDefault(edge.getTargetNodeId(), edge.getTargetNodeId())),
                edge.getRelationshipType(),
                String.format(Locale.ROOT, "%.2f", edge.getConfidence()),
                String.valueOf(edge.getOccurrences()),
                edge.getLastUpdated().toString()));
            writer.newLine();
        }
        writer.flush();
    }

    private static String formatProperties(Map<String, Object> values) {
        return values.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining("; "));
    }

    /**
     * RFC 4180: quotes fields containing commas, newlines, or quotes and doubles embedded quotes.
     */
    static String escapeCsv(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        boolean needsQuoting = value.contains(",")
            || value.contains("\"")
            || value.contains("\n")
            || value.contains("\r");
        if (needsQuoting) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.CSV;
    }
}
