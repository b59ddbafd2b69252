package com.metricsfusion.core.merge;

import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.RuleBreakdownEntry;
import com.metricsfusion.core.model.SourceLocation;
import com.metricsfusion.core.model.ThresholdStatus;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds incoming metric readings and source locations into an existing node.
 *
 * Rules, per metric:
 * <ul>
 *   <li>nothing stored: adopt a copy of the incoming reading</li>
 *   <li>additive: sum the values that are present, merge breakdowns per rule even when a side
 *       has no value</li>
 *   <li>stored value empty: adopt a copy of the incoming reading</li>
 *   <li>otherwise: first value seen wins</li>
 * </ul>
 */
public final class MetricMerger {

    private MetricMerger() {}

    /** Finding counts are summed across sources; everything else is first-wins. */
    public static boolean isAdditive(MetricIdentifier metric) {
        return switch (metric) {
            case CA_RULE_VIOLATIONS, IDE_RULE_VIOLATIONS -> true;
            case SEQUENCE_COVERAGE, BRANCH_COVERAGE, COVERAGE_CYCLOMATIC_COMPLEXITY, NPATH_COMPLEXITY,
                 MAINTAINABILITY_INDEX, CYCLOMATIC_COMPLEXITY, CLASS_COUPLING, DEPTH_OF_INHERITANCE,
                 SOURCE_LINES, EXECUTABLE_LINES -> false;
        };
    }

    public static void mergeMetrics(MetricsNode target, Map<MetricIdentifier, MetricValue> incoming) {
        incoming.forEach((metric, value) -> mergeMetric(target, metric, value));
    }

    public static void mergeMetric(MetricsNode target, MetricIdentifier metric, MetricValue incoming) {
        if (incoming == null) {
            return;
        }
        MetricValue existing = target.metric(metric);
        if (existing == null) {
            target.putMetric(metric, adopt(metric, incoming));
            return;
        }
        if (isAdditive(metric)) {
            MetricValue sum = new MetricValue(sum(existing.value, incoming.value));
            sum.status = ThresholdStatus.NOT_APPLICABLE;
            sum.unit = metric.unit();
            sum.breakdown = mergeBreakdown(existing.breakdown, incoming.breakdown);
            target.putMetric(metric, sum);
            return;
        }
        if (!existing.hasValue() && incoming.hasValue()) {
            target.putMetric(metric, adopt(metric, incoming));
        }
    }

    private static BigDecimal sum(BigDecimal first, BigDecimal second) {
        if (first == null) {
            return second;
        }
        return second == null ? first : first.add(second);
    }

    /**
     * Union of two per-rule breakdowns: counts are summed and violation lists concatenated.
     * Neither argument is modified. Returns null when both are null.
     */
    public static Map<String, RuleBreakdownEntry> mergeBreakdown(Map<String, RuleBreakdownEntry> first,
                                                                 Map<String, RuleBreakdownEntry> second) {
        if (first == null && second == null) {
            return null;
        }
        Map<String, RuleBreakdownEntry> merged = new LinkedHashMap<>();
        if (first != null) {
            first.forEach((ruleId, entry) -> merged.put(ruleId, entry.copy()));
        }
        if (second != null) {
            second.forEach((ruleId, entry) -> {
                RuleBreakdownEntry target = merged.get(ruleId);
                if (target == null) {
                    merged.put(ruleId, entry.copy());
                } else {
                    target.count += entry.count;
                    target.violations.addAll(entry.getViolations());
                }
            });
        }
        return merged;
    }

    /**
     * Keeps the most precise location seen: a location with a start line beats one without,
     * and one with start and end beats one with only a start.
     */
    public static void mergeSource(MetricsNode node, SourceLocation incoming) {
        if (incoming == null) {
            return;
        }
        SourceLocation existing = node.source();
        if (existing == null
                || (!existing.hasStartLine() && incoming.hasStartLine())
                || (existing.hasStartLine() && !existing.hasEndLine()
                    && incoming.hasStartLine() && incoming.hasEndLine())) {
            node.setSource(incoming);
        }
    }

    private static MetricValue adopt(MetricIdentifier metric, MetricValue incoming) {
        MetricValue copy = incoming.copy();
        copy.unit = metric.unit();
        return copy;
    }
}
