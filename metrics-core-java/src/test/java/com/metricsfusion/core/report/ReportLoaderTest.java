package com.metricsfusion.core.report;

import com.metricsfusion.core.model.MemberKind;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.NodeKind;
import com.metricsfusion.core.model.ThresholdStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReportLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void writtenReportLoadsBack() {
        Path written = new ReportWriter().write(ReportWriterTest.sampleReport(), tempDir);

        ReportModel.Report report = new ReportLoader().load(written);

        MetricsNode member = report.solution.descendants(NodeKind.MEMBER).get(0);
        assertEquals("N.Worker.Run(...)", member.fullyQualifiedName());
        assertEquals(MemberKind.METHOD, member.memberKind());
        assertTrue(member.includesSynthesizedCoverage());
        assertTrue(member.isNew());
        assertEquals(10, member.source().startLine());

        MetricValue complexity = member.metric(MetricIdentifier.CYCLOMATIC_COMPLEXITY);
        assertEquals(ThresholdStatus.WARNING, complexity.status);
        assertEquals(new BigDecimal("-5"), complexity.delta);
        assertEquals(MetricIdentifier.CYCLOMATIC_COMPLEXITY.unit(), complexity.unit);
        assertFalse(member.hasMetric(MetricIdentifier.SEQUENCE_COVERAGE));

        assertEquals("2024-03-01T12:00:00Z", report.metadata.generatedAt);
    }

    @Test
    void unknownMetricIdsSkipped() throws IOException {
        Path file = tempDir.resolve("baseline.json");
        Files.writeString(file, """
                {
                  "solution": {
                    "kind": "Solution",
                    "name": "Sample",
                    "metrics": {
                      "RoslynSourceLines": { "value": 120, "status": "Success" },
                      "SomeRetiredMetric": { "value": 1, "status": "Success" }
                    },
                    "assemblies": []
                  }
                }
                """);

        MetricsNode solution = new ReportLoader().loadBaseline(file);

        assertEquals(1, solution.metrics().size());
        assertEquals("120", solution.metric(MetricIdentifier.SOURCE_LINES).value.toPlainString());
    }

    @Test
    void missingFileRejected() {
        ReportLoader.ReportLoadException e = assertThrows(ReportLoader.ReportLoadException.class,
                () -> new ReportLoader().load(tempDir.resolve("absent.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void invalidJsonRejected() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"solution\": { \"kind\": ");

        assertThrows(ReportLoader.ReportLoadException.class, () -> new ReportLoader().load(file));
    }

    @Test
    void reportWithoutSolutionRejected() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "{ \"metadata\": {} }");

        assertThrows(ReportLoader.ReportLoadException.class, () -> new ReportLoader().load(file));
    }

    @Test
    void nonSolutionRootRejected() throws IOException {
        Path file = tempDir.resolve("type.json");
        Files.writeString(file, "{ \"solution\": { \"kind\": \"Type\", \"name\": \"Worker\", \"members\": [] } }");

        ReportLoader.ReportLoadException e = assertThrows(ReportLoader.ReportLoadException.class,
                () -> new ReportLoader().load(file));
        assertTrue(e.getMessage().contains("expected Solution"));
    }
}
