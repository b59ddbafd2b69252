package com.metricsfusion.core.merge;

import com.metricsfusion.core.filter.AssemblyFilter;
import com.metricsfusion.core.filter.SymbolFilters;
import com.metricsfusion.core.model.DocumentSource;
import com.metricsfusion.core.model.MemberKind;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.ParsedCodeElement;
import com.metricsfusion.core.model.ParsedMetricsDocument;
import com.metricsfusion.core.model.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuralElementMergerTest {

    private static ParsedMetricsDocument doc(String path, ParsedCodeElement... elements) {
        return new ParsedMetricsDocument("Sample", path, DocumentSource.CODE_METRICS, Arrays.asList(elements));
    }

    private static MergeSession mergeAll(SymbolFilters filters, ParsedMetricsDocument... documents) {
        MergeSession session = new MergeSession("Sample");
        StructuralElementMerger merger = new StructuralElementMerger(session, filters);
        for (ParsedMetricsDocument document : documents) {
            merger.merge(document);
        }
        return session;
    }

    @Test
    void knownNamespaceWinsOverSlicing() {
        MergeSession session = mergeAll(SymbolFilters.none(),
                doc("metrics.json",
                        ParsedCodeElement.assembly("Services"),
                        ParsedCodeElement.namespace("Company.Services", "Services")),
                doc("coverage.json",
                        ParsedCodeElement.member("Company.Services.Core.Worker.Run(...)", null, null)));

        MergeSession.TypeEntry worker = session.type("Company.Services.Core.Worker").orElseThrow();
        assertEquals("Company.Services", worker.namespace().name());
        assertEquals("Services", worker.assembly().name());
        assertEquals("Worker", worker.node().name());
    }

    @Test
    void longestKnownNamespaceIsChosen() {
        MergeSession session = mergeAll(SymbolFilters.none(),
                doc("metrics.json",
                        ParsedCodeElement.assembly("Services"),
                        ParsedCodeElement.namespace("Company.Services", "Services"),
                        ParsedCodeElement.namespace("Company.Services.Core", "Services")),
                doc("coverage.json",
                        ParsedCodeElement.member("Company.Services.Core.Worker.Run(...)", null, null)));

        MergeSession.TypeEntry worker = session.type("Company.Services.Core.Worker").orElseThrow();
        assertEquals("Company.Services.Core", worker.namespace().name());
        assertEquals("Worker", worker.node().name());
    }

    @Test
    void unknownNamespaceIsSlicedFromTypeName() {
        MergeSession session = mergeAll(SymbolFilters.none(),
                doc("coverage.json", ParsedCodeElement.member("A.B.C.Go(...)", null, "Lib")));

        MergeSession.TypeEntry type = session.type("A.B.C").orElseThrow();
        assertEquals("A.B", type.namespace().name());
        assertEquals("Lib", type.assembly().name());
    }

    @Test
    void sameSymbolFromTwoDocumentsIsOneNode() {
        ParsedCodeElement fromMetrics = ParsedCodeElement.member("N.T.M(...)", "N.T", "Lib")
                .withMetric(MetricIdentifier.CYCLOMATIC_COMPLEXITY, MetricValue.of(4));
        ParsedCodeElement fromCoverage = ParsedCodeElement.member("N.T.M(...)", "N.T", "Lib")
                .withMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of("87.5"));

        MergeSession session = mergeAll(SymbolFilters.none(), doc("a.json", fromMetrics), doc("b.json", fromCoverage));

        assertEquals(1, session.members().size());
        MetricsNode member = session.member("N.T.M(...)").orElseThrow().node();
        assertEquals("4", member.metric(MetricIdentifier.CYCLOMATIC_COMPLEXITY).value.toPlainString());
        assertEquals("87.5", member.metric(MetricIdentifier.SEQUENCE_COVERAGE).value.toPlainString());
    }

    @Test
    void genericMethodKindIsRefinedButNeverDowngraded() {
        ParsedCodeElement asMethod = ParsedCodeElement.member("N.T.Name(...)", "N.T", "Lib");
        ParsedCodeElement asProperty = asMethod.withMemberKind(MemberKind.PROPERTY);

        MergeSession refined = mergeAll(SymbolFilters.none(), doc("a.json", asMethod), doc("b.json", asProperty));
        assertEquals(MemberKind.PROPERTY, refined.member("N.T.Name(...)").orElseThrow().node().memberKind());

        MergeSession kept = mergeAll(SymbolFilters.none(), doc("a.json", asProperty), doc("b.json", asMethod));
        assertEquals(MemberKind.PROPERTY, kept.member("N.T.Name(...)").orElseThrow().node().memberKind());
    }

    @Test
    void mostPreciseSourceLocationWins() {
        ParsedCodeElement base = ParsedCodeElement.member("N.T.M(...)", "N.T", "Lib");
        MergeSession session = mergeAll(SymbolFilters.none(),
                doc("a.json", base.withSource(new SourceLocation("src/T.cs", null, null))),
                doc("b.json", base.withSource(new SourceLocation("src/T.cs", 10, null))),
                doc("c.json", base.withSource(SourceLocation.of("src/T.cs", 10, 24))),
                doc("d.json", base.withSource(new SourceLocation("src/Other.cs", null, null))));

        SourceLocation source = session.member("N.T.M(...)").orElseThrow().node().source();
        assertEquals("src/T.cs", source.path());
        assertEquals(10, source.startLine());
        assertEquals(24, source.endLine());
    }

    @Test
    void malformedElementsAreSkippedWithWarning() {
        List<ParsedCodeElement> elements = new ArrayList<>();
        elements.add(null);
        elements.add(ParsedCodeElement.member(null, "N.T", "Lib"));
        elements.add(ParsedCodeElement.member("N.T.Ok(...)", "N.T", "Lib"));

        MergeSession session = mergeAll(SymbolFilters.none(),
                new ParsedMetricsDocument("Sample", "broken.json", DocumentSource.CODE_METRICS, elements));

        assertEquals(2, session.warnings().size());
        assertEquals("broken.json", session.warnings().get(0).sourcePath());
        assertTrue(session.member("N.T.Ok(...)").isPresent());
    }

    @Test
    void excludedAssemblyContributesNothing() {
        SymbolFilters filters = new SymbolFilters(null, null, AssemblyFilter.fromPatterns("*.Tests"), null);
        MergeSession session = mergeAll(filters,
                doc("a.json",
                        ParsedCodeElement.assembly("App.Tests"),
                        ParsedCodeElement.type("App.Tests.WorkerTests", "App.Tests", "App.Tests"),
                        ParsedCodeElement.member("App.Tests.WorkerTests.Runs(...)", "App.Tests.WorkerTests", "App.Tests")));

        assertTrue(session.types().isEmpty());
        assertTrue(session.members().isEmpty());
        assertTrue(session.solution().children().isEmpty());
    }

    @Test
    void membersKeepFirstSeenOrder() {
        MergeSession session = mergeAll(SymbolFilters.none(),
                doc("a.json",
                        ParsedCodeElement.member("N.T.B(...)", "N.T", "Lib"),
                        ParsedCodeElement.member("N.T.A(...)", "N.T", "Lib")),
                doc("b.json",
                        ParsedCodeElement.member("N.T.A(...)", "N.T", "Lib"),
                        ParsedCodeElement.member("N.T.C(...)", "N.T", "Lib")));

        List<String> names = session.type("N.T").orElseThrow().node().children().stream()
                .map(MetricsNode::fullyQualifiedName)
                .toList();
        assertEquals(List.of("N.T.B(...)", "N.T.A(...)", "N.T.C(...)"), names);
    }
}
