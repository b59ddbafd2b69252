package com.metricsfusion.core.evaluate;

import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.SymbolLevel;
import com.metricsfusion.core.model.ThresholdStatus;

import java.math.BigDecimal;

/**
 * Classifies one metric value against its threshold.
 */
public final class ThresholdEvaluator {

    private ThresholdEvaluator() {}

    public static ThresholdStatus evaluate(MetricIdentifier metric, BigDecimal value, ThresholdTable table,
                                           SymbolLevel level) {
        if (value == null) {
            return ThresholdStatus.NOT_APPLICABLE;
        }
        return table.resolve(metric, level)
                .map(threshold -> evaluate(value, threshold))
                .orElse(ThresholdStatus.SUCCESS);
    }

    /**
     * Higher-is-better: below error is Error, below warning is Warning.
     * Lower-is-better: above error is Error, above warning is Warning.
     */
    public static ThresholdStatus evaluate(BigDecimal value, MetricThreshold threshold) {
        if (value == null) {
            return ThresholdStatus.NOT_APPLICABLE;
        }
        if (threshold == null || !threshold.hasCutoff()) {
            return ThresholdStatus.SUCCESS;
        }
        int sign = threshold.higherIsBetter() ? -1 : 1;
        if (threshold.error() != null && Integer.signum(value.compareTo(threshold.error())) == sign) {
            return ThresholdStatus.ERROR;
        }
        if (threshold.warning() != null && Integer.signum(value.compareTo(threshold.warning())) == sign) {
            return ThresholdStatus.WARNING;
        }
        return ThresholdStatus.SUCCESS;
    }
}
