package br.edu.ifba.mindgraph.export;

import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Writes a profile's graph in one format.
 *
 * <p>Implementations flush but do not close the stream.</p>
 *
 * @see GraphExporterFactory
 */
public interface GraphExporter {

    /**
     * @param profileId owning profile, written into headers where the format has them
     * @param nodes nodes to export (may be empty)
     * @param edges edges to export (may be empty)
     * @param outputStream destination
     * @throws IOException if writing fails
     */
    void export(
        @NotNull String profileId,
        @NotNull List<KnowledgeNode> nodes,
        @NotNull List<KnowledgeEdge> edges,
        @NotNull OutputStream outputStream
    ) throws IOException;

    ExportFormat getFormat();

    default String getMimeType() {
        return getFormat().getMimeType();
    }

    default String getFileExtension() {
        return getFormat().getExtension();
    }
}
