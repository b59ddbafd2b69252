package com.metricsfusion.core.evaluate;

import com.metricsfusion.core.model.MetricIdentifier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Thresholds used when no threshold file is configured, and the base a threshold file overlays.
 */
public final class DefaultThresholds {

    private DefaultThresholds() {}

    public static Map<MetricIdentifier, ThresholdDefinition> create() {
        Map<MetricIdentifier, ThresholdDefinition> result = new EnumMap<>(MetricIdentifier.class);
        for (MetricIdentifier metric : MetricIdentifier.values()) {
            result.put(metric, ThresholdDefinition.uniform(defaultFor(metric)));
        }
        return result;
    }

    public static MetricThreshold defaultFor(MetricIdentifier metric) {
        return switch (metric) {
            case SEQUENCE_COVERAGE              -> MetricThreshold.of(75, 60, true);
            case BRANCH_COVERAGE                -> MetricThreshold.of(70, 55, true);
            case COVERAGE_CYCLOMATIC_COMPLEXITY -> MetricThreshold.of(15, 30, false);
            case NPATH_COMPLEXITY               -> MetricThreshold.of(200, 400, false);
            case MAINTAINABILITY_INDEX          -> MetricThreshold.of(65, 40, true);
            case CYCLOMATIC_COMPLEXITY          -> MetricThreshold.of(12, 25, false);
            case CLASS_COUPLING                 -> MetricThreshold.of(50, 80, false);
            case DEPTH_OF_INHERITANCE           -> MetricThreshold.of(5, 8, false);
            case SOURCE_LINES, EXECUTABLE_LINES -> new MetricThreshold(null, null, false, true);
            case CA_RULE_VIOLATIONS             -> MetricThreshold.of(5, 10, false);
            case IDE_RULE_VIOLATIONS            -> MetricThreshold.of(10, 20, false);
        };
    }
}
