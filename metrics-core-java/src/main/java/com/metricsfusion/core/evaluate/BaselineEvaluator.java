package com.metricsfusion.core.evaluate;

import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.NodeKind;
import com.metricsfusion.core.model.RuleBreakdownEntry;
import com.metricsfusion.core.model.SymbolLevel;
import com.metricsfusion.core.model.ThresholdStatus;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final pass over the tree: computes deltas against an optional baseline snapshot and assigns a
 * threshold status to every metric. Entries without a value are dropped.
 *
 * Baseline nodes are matched by kind and fully qualified name, so a nested {@code Outer.Inner}
 * and a top-level {@code Inner} in the same namespace stay apart. Nodes without a fully qualified
 * name fall back to their name path below the solution ({@code Assembly/Namespace/Type/Member}).
 * The solution roots are matched to each other whatever their names, so a renamed solution
 * still lines up.
 */
public class BaselineEvaluator {

    private final ThresholdTable thresholds;

    public BaselineEvaluator(ThresholdTable thresholds) {
        this.thresholds = thresholds != null ? thresholds : ThresholdTable.empty();
    }

    /**
     * @param solution the reconciled tree, updated in place
     * @param baseline prior snapshot of the same shape, or null
     */
    public void apply(MetricsNode solution, MetricsNode baseline) {
        BaselineIndex index = new BaselineIndex();
        if (baseline != null) {
            index.add(baseline, "");
        }
        applyRecursive(solution, "", index, baseline != null);
    }

    /** Baseline nodes by kind-qualified FQN and by name path. */
    private static final class BaselineIndex {
        private final Map<String, MetricsNode> byName = new HashMap<>();
        private final Map<String, MetricsNode> byPath = new HashMap<>();

        void add(MetricsNode node, String path) {
            byPath.put(path, node);
            String key = nameKey(node);
            if (key != null) {
                byName.putIfAbsent(key, node);
            }
            for (MetricsNode child : node.children()) {
                add(child, childPath(path, child));
            }
        }

        MetricsNode find(MetricsNode node, String path) {
            String key = nameKey(node);
            if (key != null) {
                MetricsNode match = byName.get(key);
                if (match != null) {
                    return match;
                }
            }
            MetricsNode match = byPath.get(path);
            // a path hit on a differently named node is a sibling that shares the display name
            if (match != null && key != null && nameKey(match) != null) {
                return null;
            }
            return match;
        }
    }

    /** Null for the solution root and for nodes without a fully qualified name. */
    static String nameKey(MetricsNode node) {
        String fqn = node.fullyQualifiedName();
        if (node.kind() == NodeKind.SOLUTION || fqn == null || fqn.isBlank()) {
            return null;
        }
        return node.kind().label() + ":" + fqn;
    }

    private void applyRecursive(MetricsNode node, String path, BaselineIndex index, boolean hasBaseline) {
        MetricsNode previous = index.find(node, path);
        if (hasBaseline && node.kind() != NodeKind.SOLUTION) {
            node.setNew(previous == null);
        }
        node.replaceMetrics(evaluateMetrics(node, previous, node.kind().level()));
        for (MetricsNode child : node.children()) {
            applyRecursive(child, childPath(path, child), index, hasBaseline);
        }
    }

    private Map<MetricIdentifier, MetricValue> evaluateMetrics(MetricsNode node, MetricsNode previous,
                                                               SymbolLevel level) {
        Map<MetricIdentifier, MetricValue> result = new EnumMap<>(MetricIdentifier.class);
        for (Map.Entry<MetricIdentifier, MetricValue> entry : node.metrics().entrySet()) {
            MetricIdentifier metric = entry.getKey();
            MetricValue current = entry.getValue();
            ThresholdStatus status = ThresholdEvaluator.evaluate(metric, current.value, thresholds, level);
            if (status == ThresholdStatus.NOT_APPLICABLE) continue;

            MetricValue prior = previous != null ? previous.metric(metric) : null;
            MetricValue evaluated = new MetricValue(current.value);
            evaluated.delta = delta(current.value, prior != null ? prior.value : null);
            evaluated.status = status;
            evaluated.unit = metric.unit();
            evaluated.breakdown = copyBreakdown(current.breakdown);
            result.put(metric, evaluated);
        }
        return result;
    }

    /** {@code current - baseline}; null when either side is missing or the difference is zero. */
    static BigDecimal delta(BigDecimal current, BigDecimal baseline) {
        if (current == null || baseline == null) {
            return null;
        }
        BigDecimal delta = current.subtract(baseline);
        return delta.signum() == 0 ? null : delta;
    }

    private static Map<String, RuleBreakdownEntry> copyBreakdown(Map<String, RuleBreakdownEntry> breakdown) {
        if (breakdown == null) {
            return null;
        }
        Map<String, RuleBreakdownEntry> copy = new LinkedHashMap<>();
        breakdown.forEach((ruleId, entry) -> copy.put(ruleId, entry.copy()));
        return copy;
    }

    private static String childPath(String parentPath, MetricsNode child) {
        return parentPath + "/" + child.name();
    }
}
