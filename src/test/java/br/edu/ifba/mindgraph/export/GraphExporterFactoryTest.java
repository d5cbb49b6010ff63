package br.edu.ifba.mindgraph.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GraphExporterFactoryTest {

    @Test
    void testSelectsExporterByFormat() {
        GraphExporterFactory factory = new GraphExporterFactory(List.of(
            new CsvGraphExporter(), new MarkdownGraphExporter(), new JsonGraphExporter(new ObjectMapper())));

        assertInstanceOf(CsvGraphExporter.class, factory.getExporter(ExportFormat.CSV));
        assertInstanceOf(MarkdownGraphExporter.class, factory.getExporter(ExportFormat.MARKDOWN));
        assertEquals("text/markdown", factory.getExporter(ExportFormat.MARKDOWN).getMimeType());
        assertEquals("json", factory.getExporter(ExportFormat.JSON).getFileExtension());
    }

    @Test
    void testMissingExporterIsRejected() {
        GraphExporterFactory factory = new GraphExporterFactory(List.of(new CsvGraphExporter()));

        assertFalse(factory.hasExporter(ExportFormat.JSON));
        assertThrows(IllegalArgumentException.class, () -> factory.getExporter(ExportFormat.JSON));
    }

    @ParameterizedTest
    @CsvSource({
        "json, JSON",
        "CSV, CSV",
        "markdown, MARKDOWN",
        "md, MARKDOWN",
        "' csv ', CSV"
    })
    void testFormatFromString(String value, ExportFormat expected) {
        assertEquals(expected, ExportFormat.fromString(value));
    }

    @Test
    void testBlankFormatDefaultsToJson() {
        assertEquals(ExportFormat.JSON, ExportFormat.fromString(null));
        assertEquals(ExportFormat.JSON, ExportFormat.fromString(""));
    }

    @Test
    void testUnknownFormatIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.fromString("xlsx"));
    }
}
