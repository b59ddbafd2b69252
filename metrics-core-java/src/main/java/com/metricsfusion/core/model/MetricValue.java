package com.metricsfusion.core.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single metric reading. {@code delta} and {@code status} are filled in by the evaluator;
 * {@code breakdown} is only used by finding-count metrics.
 */
public class MetricValue {

    public BigDecimal value;
    public BigDecimal delta;
    public ThresholdStatus status = ThresholdStatus.NOT_APPLICABLE;
    public transient MetricUnit unit;
    public Map<String, RuleBreakdownEntry> breakdown;

    public MetricValue() {}

    public MetricValue(BigDecimal value) {
        this.value = value;
    }

    public static MetricValue of(long value) {
        return new MetricValue(BigDecimal.valueOf(value));
    }

    public static MetricValue of(String value) {
        return new MetricValue(new BigDecimal(value));
    }

    public static MetricValue empty() {
        return new MetricValue(null);
    }

    public boolean hasValue() {
        return value != null;
    }

    /** True when a value is present and differs from zero. */
    public boolean isNonZero() {
        return value != null && value.signum() != 0;
    }

    public Map<String, RuleBreakdownEntry> getBreakdown() {
        return breakdown != null ? breakdown : Map.of();
    }

    /** Deep copy; breakdown entries and their violation lists are not shared. */
    public MetricValue copy() {
        MetricValue copy = new MetricValue(value);
        copy.delta = delta;
        copy.status = status;
        copy.unit = unit;
        if (breakdown != null) {
            copy.breakdown = new LinkedHashMap<>();
            breakdown.forEach((ruleId, entry) -> copy.breakdown.put(ruleId, entry.copy()));
        }
        return copy;
    }
}
