package com.metricsfusion.core.evaluate;

import com.metricsfusion.core.model.SymbolLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * All per-level thresholds of one metric plus its human-readable description.
 */
public record ThresholdDefinition(String description, Map<SymbolLevel, MetricThreshold> levels) {

    public ThresholdDefinition {
        EnumMap<SymbolLevel, MetricThreshold> copy = new EnumMap<>(SymbolLevel.class);
        if (levels != null) {
            levels.forEach((level, threshold) -> {
                if (level != null && threshold != null) {
                    copy.put(level, threshold);
                }
            });
        }
        levels = Collections.unmodifiableMap(copy);
    }

    /** The same threshold at every level. */
    public static ThresholdDefinition uniform(MetricThreshold threshold) {
        EnumMap<SymbolLevel, MetricThreshold> levels = new EnumMap<>(SymbolLevel.class);
        for (SymbolLevel level : SymbolLevel.values()) {
            levels.put(level, threshold);
        }
        return new ThresholdDefinition(null, levels);
    }

    /** Exact level first, then the Type level as fallback. */
    public Optional<MetricThreshold> forLevel(SymbolLevel level) {
        MetricThreshold exact = levels.get(level);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(levels.get(SymbolLevel.TYPE));
    }

    public ThresholdDefinition withDescription(String description) {
        return new ThresholdDefinition(description, levels);
    }
}
