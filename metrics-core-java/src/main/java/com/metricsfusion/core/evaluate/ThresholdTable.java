package com.metricsfusion.core.evaluate;

import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.SymbolLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Report-level thresholds plus optional per-run overrides. Overrides win per (metric, level).
 */
public final class ThresholdTable {

    private final Map<MetricIdentifier, ThresholdDefinition> report;
    private final Map<MetricIdentifier, ThresholdDefinition> overrides;

    public ThresholdTable(Map<MetricIdentifier, ThresholdDefinition> report,
                          Map<MetricIdentifier, ThresholdDefinition> overrides) {
        this.report = copyOf(report);
        this.overrides = copyOf(overrides);
    }

    public static ThresholdTable of(Map<MetricIdentifier, ThresholdDefinition> report) {
        return new ThresholdTable(report, Map.of());
    }

    public static ThresholdTable defaults() {
        return of(DefaultThresholds.create());
    }

    public static ThresholdTable empty() {
        return new ThresholdTable(Map.of(), Map.of());
    }

    public ThresholdTable withOverrides(Map<MetricIdentifier, ThresholdDefinition> overrides) {
        return new ThresholdTable(report, overrides);
    }

    /** Override for the exact level, else the report table (exact level, then Type). */
    public Optional<MetricThreshold> resolve(MetricIdentifier metric, SymbolLevel level) {
        ThresholdDefinition override = overrides.get(metric);
        if (override != null && override.levels().containsKey(level)) {
            return Optional.of(override.levels().get(level));
        }
        ThresholdDefinition definition = report.get(metric);
        return definition == null ? Optional.empty() : definition.forLevel(level);
    }

    /** Report thresholds with overrides applied, for report metadata. */
    public Map<MetricIdentifier, ThresholdDefinition> effective() {
        Map<MetricIdentifier, ThresholdDefinition> result = new EnumMap<>(MetricIdentifier.class);
        result.putAll(report);
        overrides.forEach((metric, override) -> {
            ThresholdDefinition base = result.get(metric);
            if (base == null) {
                result.put(metric, override);
                return;
            }
            Map<SymbolLevel, MetricThreshold> levels = new EnumMap<>(SymbolLevel.class);
            levels.putAll(base.levels());
            levels.putAll(override.levels());
            String description = override.description() != null ? override.description() : base.description();
            result.put(metric, new ThresholdDefinition(description, levels));
        });
        return Collections.unmodifiableMap(result);
    }

    private static Map<MetricIdentifier, ThresholdDefinition> copyOf(Map<MetricIdentifier, ThresholdDefinition> source) {
        Map<MetricIdentifier, ThresholdDefinition> copy = new EnumMap<>(MetricIdentifier.class);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }
}
