package br.edu.ifba.mindgraph.export;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.Map;

/**
 * Selects the {@link GraphExporter} for a format among the CDI-discovered implementations.
 */
@ApplicationScoped
public class GraphExporterFactory {

    private final Map<ExportFormat, GraphExporter> exporters;

    /**
     * Default constructor for CDI proxy.
     */
    public GraphExporterFactory() {
        this.exporters = new EnumMap<>(ExportFormat.class);
    }

    @Inject
    public GraphExporterFactory(Instance<GraphExporter> exporterInstances) {
        this(exporterInstances.stream().toList());
    }

    public GraphExporterFactory(Iterable<GraphExporter> exporterInstances) {
        this.exporters = new EnumMap<>(ExportFormat.class);
        for (GraphExporter exporter : exporterInstances) {
            exporters.put(exporter.getFormat(), exporter);
        }
    }

    /**
     * @throws IllegalArgumentException if no exporter is registered for the format
     */
    @NotNull
    public GraphExporter getExporter(@NotNull ExportFormat format) {
        GraphExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new IllegalArgumentException(
                "No exporter registered for format: " + format + ". Available formats: " + exporters.keySet());
        }
        return exporter;
    }

    public boolean hasExporter(@NotNull ExportFormat format) {
        return exporters.containsKey(format);
    }
}
