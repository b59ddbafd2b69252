package com.metricsfusion.core;

import com.metricsfusion.core.evaluate.BaselineEvaluator;
import com.metricsfusion.core.merge.AggregationCancelledException;
import com.metricsfusion.core.merge.CoverageDuplicateGuard;
import com.metricsfusion.core.merge.MalformedDocumentException;
import com.metricsfusion.core.merge.MemberExclusionPass;
import com.metricsfusion.core.merge.MergeSession;
import com.metricsfusion.core.merge.StructuralElementMerger;
import com.metricsfusion.core.model.DocumentSource;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.ParsedMetricsDocument;
import com.metricsfusion.core.model.RuleDescription;
import com.metricsfusion.core.reconcile.IteratorCoverageReconciler;
import com.metricsfusion.core.reconcile.NestedTypeNotationReconciler;
import com.metricsfusion.core.reconcile.TypeBranchCoverageApplicability;
import com.metricsfusion.core.reconcile.TypeSourceBackfiller;
import com.metricsfusion.core.report.ReportMetadataBuilder;
import com.metricsfusion.core.report.ReportModel;
import com.metricsfusion.core.suppression.SuppressionBinder;

import java.time.Clock;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one aggregation: duplicate guard, structural merge, member exclusion, reconciliation,
 * baseline and thresholds, suppression binding.
 *
 * Documents are merged strictly in submission order. Configuration problems (suppression
 * entries that cannot be bound, malformed document roots) are reported before any merge work.
 */
public class MetricsAggregator {

    static final String DEFAULT_SOLUTION_NAME = "Solution";

    private final SuppressionBinder suppressionBinder;
    private final Clock clock;

    public MetricsAggregator() {
        this(new SuppressionBinder(), Clock.systemUTC());
    }

    public MetricsAggregator(SuppressionBinder suppressionBinder, Clock clock) {
        this.suppressionBinder = suppressionBinder;
        this.clock = clock;
    }

    public AggregationResult aggregate(AggregationRequest request) {
        List<ParsedMetricsDocument> documents = request.documents() != null ? request.documents() : List.of();

        // --- Validate before merging anything ---
        int index = 0;
        for (ParsedMetricsDocument document : documents) {
            index++;
            if (document == null) {
                throw new MalformedDocumentException("Document #" + index + " is null", null);
            }
            String path = document.sourcePath() != null ? document.sourcePath() : "document#" + index;
            if (document.elements() == null) {
                throw new MalformedDocumentException("Document has no element list: " + path, path);
            }
            // the coverage overlap check keys on the source kind
            if (document.source() == null) {
                throw new MalformedDocumentException("Document has no source kind (expected one of "
                        + Arrays.toString(DocumentSource.values()) + "): " + path, path);
            }
        }
        suppressionBinder.bind(request.suppressedSymbols());
        new CoverageDuplicateGuard().verify(documents);

        // --- Structural merge ---
        MergeSession session = new MergeSession(solutionName(documents, request.solutionName()));
        StructuralElementMerger merger = new StructuralElementMerger(session, request.filters());
        Map<String, RuleDescription> ruleDescriptions = new LinkedHashMap<>();
        index = 0;
        for (ParsedMetricsDocument document : documents) {
            index++;
            if (request.cancellation().getAsBoolean()) {
                throw new AggregationCancelledException(
                        document.sourcePath() != null ? document.sourcePath() : "document#" + index);
            }
            merger.merge(document);
            document.getRuleDescriptions().forEach(ruleDescriptions::putIfAbsent);
        }

        // --- Post-merge passes ---
        int excluded = new MemberExclusionPass(request.filters()).apply(session);
        int stateMachines = IteratorCoverageReconciler.reconcile(session);
        int nestedTypes = NestedTypeNotationReconciler.reconcile(session);
        TypeBranchCoverageApplicability.apply(session);
        TypeSourceBackfiller.populateMissingSources(session);
        System.err.println("[metrics-fusion] Merged " + documents.size() + " documents: "
                + session.types().size() + " types, " + session.members().size() + " members ("
                + excluded + " members excluded, " + stateMachines + " state machines and "
                + nestedTypes + " nested types folded)");

        // --- Baseline and thresholds ---
        MetricsNode solution = session.solution();
        new BaselineEvaluator(request.thresholds()).apply(solution, request.baseline());

        List<ReportModel.SuppressedSymbolEntry> suppressed =
                suppressionBinder.apply(solution, request.suppressedSymbols());
        Map<String, RuleDescription> usedDescriptions = usedRuleDescriptions(solution, ruleDescriptions);

        ReportModel.Report report = new ReportModel.Report();
        report.solution = solution;
        report.metadata = new ReportMetadataBuilder()
                .thresholds(request.thresholds())
                .filters(request.filters())
                .ruleDescriptions(usedDescriptions)
                .suppressedSymbols(suppressed)
                .generatedAt(clock.instant())
                .build();

        return new AggregationResult(solution, session.warnings(), usedDescriptions, suppressed, report);
    }

    /** First non-blank document solution name, else the configured one, else "Solution". */
    static String solutionName(List<ParsedMetricsDocument> documents, String configured) {
        for (ParsedMetricsDocument document : documents) {
            if (document.solutionName() != null && !document.solutionName().isBlank()) {
                return document.solutionName();
            }
        }
        return configured != null && !configured.isBlank() ? configured : DEFAULT_SOLUTION_NAME;
    }

    /**
     * Keeps only descriptions of rules that appear in some breakdown. When no breakdown names a
     * rule, all descriptions are kept.
     */
    static Map<String, RuleDescription> usedRuleDescriptions(MetricsNode solution,
                                                             Map<String, RuleDescription> descriptions) {
        Set<String> used = new HashSet<>();
        solution.walk(node -> {
            for (MetricValue value : node.metrics().values()) {
                used.addAll(value.getBreakdown().keySet());
            }
        });
        if (used.isEmpty()) {
            return descriptions;
        }
        Map<String, RuleDescription> result = new LinkedHashMap<>();
        descriptions.forEach((ruleId, description) -> {
            if (used.contains(ruleId)) {
                result.put(ruleId, description);
            }
        });
        return result;
    }
}
