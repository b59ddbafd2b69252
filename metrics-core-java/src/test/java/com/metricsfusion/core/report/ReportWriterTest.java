package com.metricsfusion.core.report;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.metricsfusion.core.evaluate.ThresholdTable;
import com.metricsfusion.core.filter.MemberFilter;
import com.metricsfusion.core.filter.SymbolFilters;
import com.metricsfusion.core.model.MemberKind;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.NodeKind;
import com.metricsfusion.core.model.RuleDescription;
import com.metricsfusion.core.model.SourceLocation;
import com.metricsfusion.core.model.ThresholdStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    static ReportModel.Report sampleReport() {
        MetricsNode solution = MetricsNode.solution("Sample");
        MetricsNode assembly = new MetricsNode(NodeKind.ASSEMBLY, "Lib", "Lib");
        MetricsNode namespace = new MetricsNode(NodeKind.NAMESPACE, "N", "N");
        MetricsNode type = new MetricsNode(NodeKind.TYPE, "Worker", "N.Worker");
        MetricsNode member = new MetricsNode(NodeKind.MEMBER, "Run", "N.Worker.Run(...)");
        solution.addChild(assembly);
        assembly.addChild(namespace);
        namespace.addChild(type);
        type.addChild(member);

        MetricValue complexity = MetricValue.of(48);
        complexity.status = ThresholdStatus.WARNING;
        complexity.delta = new BigDecimal("-5");
        member.putMetric(MetricIdentifier.CYCLOMATIC_COMPLEXITY, complexity);
        member.putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(90));
        member.setMemberKind(MemberKind.METHOD);
        member.markSynthesizedCoverage();
        member.setNew(true);
        member.setSource(SourceLocation.of("src/Worker.cs", 10, 20));

        ReportModel.Report report = new ReportModel.Report();
        report.solution = solution;
        report.metadata = new ReportMetadataBuilder()
                .thresholds(ThresholdTable.defaults())
                .filters(new SymbolFilters(MemberFilter.fromPatterns("Dispose", false), null, null, null))
                .ruleDescriptions(Map.of("CA2000", new RuleDescription("Dispose objects", "Reliability"),
                        "CA1822", new RuleDescription("Mark members as static", "Performance")))
                .generatedAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();
        return report;
    }

    @Test
    void writesReportFileIntoNewDirectory() throws IOException {
        Path out = tempDir.resolve("nested/out");
        Path written = new ReportWriter().write(sampleReport(), out);

        assertEquals(out.resolve(ReportWriter.REPORT_FILE), written);
        assertTrue(Files.exists(written));
    }

    @Test
    void childArraysNamedPerKind() throws IOException {
        Path written = new ReportWriter().write(sampleReport(), tempDir);
        JsonObject root = JsonParser.parseString(Files.readString(written)).getAsJsonObject();

        JsonObject solution = root.getAsJsonObject("solution");
        assertEquals("Solution", solution.get("kind").getAsString());
        JsonObject assembly = solution.getAsJsonArray("assemblies").get(0).getAsJsonObject();
        JsonObject namespace = assembly.getAsJsonArray("namespaces").get(0).getAsJsonObject();
        JsonObject type = namespace.getAsJsonArray("types").get(0).getAsJsonObject();
        JsonObject member = type.getAsJsonArray("members").get(0).getAsJsonObject();

        assertEquals("N.Worker.Run(...)", member.get("fullyQualifiedName").getAsString());
        assertEquals("Method", member.get("memberKind").getAsString());
        assertTrue(member.get("includesSynthesizedCoverage").getAsBoolean());
        assertTrue(member.get("isNew").getAsBoolean());
        assertFalse(member.has("members"));
        assertFalse(type.has("isNew"));
    }

    @Test
    void notApplicableMetricsNeverWritten() throws IOException {
        Path written = new ReportWriter().write(sampleReport(), tempDir);
        String json = Files.readString(written);

        assertTrue(json.contains("\"RoslynCyclomaticComplexity\""));
        assertTrue(json.contains("\"Warning\""));
        assertFalse(json.contains("AltCoverSequenceCoverage\": {"), "NotApplicable reading must be omitted");
        assertFalse(json.contains("NotApplicable"));
    }

    @Test
    void metadataDescribesRun() throws IOException {
        Path written = new ReportWriter().write(sampleReport(), tempDir);
        JsonObject metadata = JsonParser.parseString(Files.readString(written)).getAsJsonObject()
                .getAsJsonObject("metadata");

        assertEquals("2024-03-01T12:00:00Z", metadata.get("generatedAt").getAsString());
        assertEquals("percent", metadata.getAsJsonObject("metricDescriptors")
                .getAsJsonObject("AltCoverSequenceCoverage").get("unit").getAsString());
        assertEquals("Dispose", metadata.getAsJsonObject("filters").getAsJsonArray("excludedMembers")
                .get(0).getAsString());
        assertFalse(metadata.getAsJsonObject("filters").get("caseSensitiveMemberPatterns").getAsBoolean());
        assertEquals(MetricIdentifier.values().length, metadata.getAsJsonArray("thresholds").size());

        // sorted by rule id
        assertEquals("[CA1822, CA2000]", metadata.getAsJsonObject("ruleDescriptions").keySet().toString());
    }

    @Test
    void missingSolutionRejected() {
        assertThrows(ReportWriter.ReportWriteException.class,
                () -> new ReportWriter().write(new ReportModel.Report(), tempDir));
    }
}
