package com.metricsfusion.core.evaluate;

import java.math.BigDecimal;

/**
 * Warning and error cutoffs for one metric at one symbol level. Either cutoff may be null.
 *
 * @param higherIsBetter       true for coverage-like metrics, false for complexity-like ones
 * @param positiveDeltaNeutral a growing value is neither good nor bad (e.g. line counts)
 */
public record MetricThreshold(BigDecimal warning, BigDecimal error, boolean higherIsBetter,
                              boolean positiveDeltaNeutral) {

    public static MetricThreshold of(Number warning, Number error, boolean higherIsBetter) {
        return new MetricThreshold(toDecimal(warning), toDecimal(error), higherIsBetter, false);
    }

    public boolean hasCutoff() {
        return warning != null || error != null;
    }

    /** Same cutoffs, different direction flags. */
    public MetricThreshold withDirection(boolean higherIsBetter, boolean positiveDeltaNeutral) {
        return new MetricThreshold(warning, error, higherIsBetter, positiveDeltaNeutral);
    }

    private static BigDecimal toDecimal(Number value) {
        return value == null ? null : new BigDecimal(value.toString());
    }
}
