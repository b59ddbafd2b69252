package com.metricsfusion.adapter;

import com.metricsfusion.adapter.manifest.ManifestConfig;
import com.metricsfusion.adapter.manifest.ManifestReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestReaderTest {

    private final ManifestReader reader = new ManifestReader();

    @Test
    void roundTrip(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "solution_name": "Sample",
              "documents": ["coverage.json", "metrics.json"],
              "thresholds": "thresholds.json",
              "threshold_overrides": "overrides.json",
              "baseline": "previous/report.json",
              "suppressed_symbols": "suppressed.json",
              "excluded_members": "Dispose;get_*",
              "excluded_types": "Migrations",
              "excluded_assemblies": "*.Tests",
              "exclude_properties": true,
              "case_sensitive_member_patterns": false,
              "metric_aliases": { "RoslynCyclomaticComplexity": ["CC"] }
            }
            """;
        Path manifest = tmp.resolve("run.json");
        Files.writeString(manifest, json);

        ManifestConfig config = reader.read(manifest);
        assertEquals("Sample", config.getSolutionName());
        assertEquals(List.of("coverage.json", "metrics.json"), config.getDocuments());
        assertEquals("thresholds.json", config.getThresholds());
        assertEquals("overrides.json", config.getThresholdOverrides());
        assertEquals("previous/report.json", config.getBaseline());
        assertEquals("suppressed.json", config.getSuppressedSymbols());
        assertEquals("Dispose;get_*", config.getExcludedMembers());
        assertEquals("Migrations", config.getExcludedTypes());
        assertEquals("*.Tests", config.getExcludedAssemblies());
        assertTrue(config.isExcludeProperties());
        assertFalse(config.isExcludeMethods());
        assertFalse(config.isCaseSensitiveMemberPatterns());
        assertEquals(Map.of("RoslynCyclomaticComplexity", List.of("CC")), config.getMetricAliases());
    }

    @Test
    void optionalFieldsDefault(@TempDir Path tmp) throws IOException {
        Path manifest = tmp.resolve("run.json");
        Files.writeString(manifest, """
            { "documents": ["a.json"] }
            """);

        ManifestConfig config = reader.read(manifest);
        assertNull(config.getThresholds());
        assertNull(config.getBaseline());
        assertTrue(config.isCaseSensitiveMemberPatterns());
        assertFalse(config.isExcludeEvents());
        assertNotNull(config.getMetricAliases());
        assertTrue(config.getMetricAliases().isEmpty());
    }

    @Test
    void fileNotFoundThrowsManifestReadException(@TempDir Path tmp) {
        Path missing = tmp.resolve("does-not-exist.json");
        assertThrows(ManifestReader.ManifestReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsManifestReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(ManifestReader.ManifestReadException.class, () -> reader.read(empty));
    }

    @Test
    void malformedJsonThrowsManifestReadException(@TempDir Path tmp) throws IOException {
        Path bad = tmp.resolve("bad.json");
        Files.writeString(bad, "{ \"documents\": [ ");
        assertThrows(ManifestReader.ManifestReadException.class, () -> reader.read(bad));
    }

    @Test
    void manifestWithoutDocumentsRejected(@TempDir Path tmp) throws IOException {
        Path manifest = tmp.resolve("run.json");
        Files.writeString(manifest, "{ \"solution_name\": \"Sample\", \"documents\": [] }");

        ManifestReader.ManifestReadException e =
                assertThrows(ManifestReader.ManifestReadException.class, () -> reader.read(manifest));
        assertTrue(e.getMessage().contains("no documents"));
    }
}
