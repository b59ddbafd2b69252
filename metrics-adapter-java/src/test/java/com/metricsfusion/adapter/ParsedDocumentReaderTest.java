package com.metricsfusion.adapter;

import com.metricsfusion.adapter.documents.ParsedDocumentReader;
import com.metricsfusion.core.model.DocumentSource;
import com.metricsfusion.core.model.ElementKind;
import com.metricsfusion.core.model.MemberKind;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricUnit;
import com.metricsfusion.core.model.ParsedCodeElement;
import com.metricsfusion.core.model.ParsedMetricsDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParsedDocumentReaderTest {

    private final ParsedDocumentReader reader = new ParsedDocumentReader();

    private static final String FINDINGS_DOC = """
        {
          "solutionName": "Sample",
          "sourcePath": "build/analysis.sarif",
          "source": "FINDINGS",
          "ruleDescriptions": {
            "CA1822": { "shortDescription": "Mark members as static", "category": "Performance" }
          },
          "elements": [
            {
              "kind": "Member",
              "fullyQualifiedName": "N.Worker.Run(...)",
              "parentFullyQualifiedName": "N.Worker",
              "containingAssemblyName": "Lib",
              "memberKind": "Method",
              "source": { "path": "src/Worker.cs", "startLine": 10, "endLine": 20 },
              "metrics": {
                "SarifCaRuleViolations": {
                  "value": 1,
                  "breakdown": {
                    "CA1822": { "count": 1, "violations": [ { "message": "static", "uri": "src/Worker.cs", "startLine": 12 } ] }
                  }
                },
                "SomeFutureMetric": { "value": 3 }
              }
            }
          ]
        }
        """;

    private static String coverageDoc(String memberFqn) {
        return """
            {
              "source": "COVERAGE",
              "elements": [
                { "kind": "Member", "fullyQualifiedName": "%s", "metrics": { "AltCoverSequenceCoverage": { "value": 75.5 } } }
              ]
            }
            """.formatted(memberFqn);
    }

    @Test
    void documentFieldsMapped(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("findings.json");
        Files.writeString(file, FINDINGS_DOC);

        ParsedMetricsDocument document = reader.read(file);

        assertEquals("Sample", document.solutionName());
        assertEquals("build/analysis.sarif", document.sourcePath());
        assertEquals(DocumentSource.FINDINGS, document.source());
        assertEquals("Performance", document.getRuleDescriptions().get("CA1822").category());

        ParsedCodeElement element = document.elements().get(0);
        assertEquals(ElementKind.MEMBER, element.kind());
        assertEquals(MemberKind.METHOD, element.memberKind());
        assertEquals("N.Worker", element.parentFullyQualifiedName());
        assertEquals(20, element.source().endLine());
        assertTrue(element.hasFindings());
        assertEquals(1, element.metrics().get(MetricIdentifier.CA_RULE_VIOLATIONS)
                .breakdown.get("CA1822").violations.size());
        assertEquals(MetricUnit.COUNT, element.metrics().get(MetricIdentifier.CA_RULE_VIOLATIONS).unit);
    }

    @Test
    void unknownMetricIdSkipped(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("findings.json");
        Files.writeString(file, FINDINGS_DOC);

        ParsedCodeElement element = reader.read(file).elements().get(0);

        assertEquals(1, element.metrics().size());
    }

    @Test
    void missingSourcePathDefaultsToFile(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("coverage.json");
        Files.writeString(file, coverageDoc("N.Worker.Run(...)"));

        ParsedMetricsDocument document = reader.read(file);

        assertEquals(file.toString(), document.sourcePath());
        assertEquals("75.5", document.elements().get(0).metrics()
                .get(MetricIdentifier.SEQUENCE_COVERAGE).value.toPlainString());
    }

    @Test
    void readAllKeepsInputOrder(@TempDir Path tmp) throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            Path file = tmp.resolve("doc-" + i + ".json");
            Files.writeString(file, coverageDoc("N.T.M" + i + "(...)"));
            files.add(file);
        }

        List<ParsedMetricsDocument> documents = reader.readAll(files);

        assertEquals(12, documents.size());
        for (int i = 0; i < 12; i++) {
            assertEquals("N.T.M" + i + "(...)", documents.get(i).elements().get(0).fullyQualifiedName());
        }
    }

    @Test
    void missingElementListLeftNull(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("empty-doc.json");
        Files.writeString(file, "{ \"source\": \"CODE_METRICS\" }");

        assertNull(reader.read(file).elements());
    }

    @Test
    void missingFileRejected(@TempDir Path tmp) {
        assertThrows(ParsedDocumentReader.DocumentReadException.class, () -> reader.read(tmp.resolve("nope.json")));
    }

    @Test
    void invalidJsonRejected(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("broken.json");
        Files.writeString(file, "{ \"elements\": [ { ");

        assertThrows(ParsedDocumentReader.DocumentReadException.class, () -> reader.read(file));
    }
}
