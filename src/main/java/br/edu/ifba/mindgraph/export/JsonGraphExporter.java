package br.edu.ifba.mindgraph.export;

import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.List;

/**
 * JSON document {@code {"profile_id", "exported_at", "nodes", "edges"}} written with
 * the application's {@link ObjectMapper}.
 */
@ApplicationScoped
public class JsonGraphExporter implements GraphExporter {

    private final ObjectMapper objectMapper;

    /**
     * Default constructor for CDI proxy.
     */
    public JsonGraphExporter() {
        this.objectMapper = null;
    }

    @Inject
    public JsonGraphExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    record GraphDocument(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("exported_at") Instant exportedAt,
        @JsonProperty("nodes") List<KnowledgeNode> nodes,
        @JsonProperty("edges") List<KnowledgeEdge> edges
    ) {
    }

    @Override
    public void export(
            @NotNull String profileId,
            @NotNull List<KnowledgeNode> nodes,
            @NotNull List<KnowledgeEdge> edges,
            @NotNull OutputStream outputStream) throws IOException {
        objectMapper.writer()
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .withDefaultPrettyPrinter()
            .writeValue(outputStream, new GraphDocument(profileId, Instant.now(), nodes, edges));
        outputStream.flush();
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.JSON;
    }
}
