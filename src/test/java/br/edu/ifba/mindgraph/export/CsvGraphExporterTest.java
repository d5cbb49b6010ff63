package br.edu.ifba.mindgraph.export;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvGraphExporterTest {

    private final CsvGraphExporter exporter = new CsvGraphExporter();

    private String export() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exporter.export("user-1", ExportFixtures.NODES, ExportFixtures.EDGES, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testWritesNodeAndEdgeSections() throws Exception {
        List<String> lines = export().lines().toList();

        assertEquals("# NODES", lines.get(0));
        assertEquals("n-sarah,PERSON,Sarah,sarah,0.90,5,2026-03-01T10:00:00Z,relationship=friend", lines.get(2));
        assertTrue(lines.contains("# EDGES"));
        assertEquals("e-1,Sarah,\"happy, relieved\",made_feel,0.80,1,2026-03-01T10:00:00Z",
            lines.get(lines.size() - 1));
    }

    @Test
    void testEscapeCsv() {
        assertEquals("plain", CsvGraphExporter.escapeCsv("plain"));
        assertEquals("\"a,b\"", CsvGraphExporter.escapeCsv("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvGraphExporter.escapeCsv("say \"hi\""));
        assertEquals("", CsvGraphExporter.escapeCsv(null));
    }

    @Test
    void testEmptyGraphWritesHeadersOnly() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exporter.export("user-1", List.of(), List.of(), out);

        assertEquals(5, out.toString(StandardCharsets.UTF_8).lines().count());
    }
}
