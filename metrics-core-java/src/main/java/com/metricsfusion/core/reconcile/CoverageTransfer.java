package com.metricsfusion.core.reconcile;

import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;

/**
 * Shared helpers for moving coverage readings between a synthetic node and the node a reader
 * actually looks at.
 */
final class CoverageTransfer {

    private CoverageTransfer() {}

    /** A node has coverage when its sequence or branch coverage is present and non-zero. */
    static boolean hasCoverage(MetricsNode node) {
        return isNonZero(node.metric(MetricIdentifier.SEQUENCE_COVERAGE))
                || isNonZero(node.metric(MetricIdentifier.BRANCH_COVERAGE));
    }

    /**
     * Copies value, status and delta of {@code metric} from {@code source} to {@code target}
     * when the source has a value and the target's reading is missing, empty or zero.
     *
     * @return true when the target was changed
     */
    static boolean copyIfAbsentOrZero(MetricsNode source, MetricsNode target, MetricIdentifier metric) {
        MetricValue incoming = source.metric(metric);
        if (incoming == null || !incoming.hasValue()) {
            return false;
        }
        if (isNonZero(target.metric(metric))) {
            return false;
        }
        MetricValue copy = new MetricValue(incoming.value);
        copy.status = incoming.status;
        copy.delta = incoming.delta;
        copy.unit = metric.unit();
        target.putMetric(metric, copy);
        return true;
    }

    private static boolean isNonZero(MetricValue value) {
        return value != null && value.isNonZero();
    }
}
