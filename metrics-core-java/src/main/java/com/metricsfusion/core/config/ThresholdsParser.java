package com.metricsfusion.core.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.metricsfusion.core.evaluate.DefaultThresholds;
import com.metricsfusion.core.evaluate.MetricThreshold;
import com.metricsfusion.core.evaluate.ThresholdDefinition;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.SymbolLevel;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads threshold documents of the form
 * <pre>
 * {"metrics": [{"name": "Complexity", "description": "...", "higherIsBetter": false,
 *               "positiveDeltaNeutral": false,
 *               "symbolThresholds": {"Type": {"warning": 12, "error": 25}}}]}
 * </pre>
 * {@link #parse} overlays the document onto the built-in defaults; every metric it returns has
 * a threshold at every level. {@link #parseOverrides} keeps only what the document lists.
 */
public final class ThresholdsParser {

    private final MetricResolver resolver;

    public ThresholdsParser() {
        this(MetricResolver.builtIn());
    }

    public ThresholdsParser(MetricResolver resolver) {
        this.resolver = resolver != null ? resolver : MetricResolver.builtIn();
    }

    /** Defaults overlaid with {@code json}; blank input yields the defaults. */
    public Map<MetricIdentifier, ThresholdDefinition> parse(String json) {
        Map<MetricIdentifier, ThresholdDefinition> thresholds = DefaultThresholds.create();
        if (json == null || json.isBlank()) {
            return thresholds;
        }
        for (JsonElement entry : metricsArray(json)) {
            applyEntry(entry, thresholds, true);
        }
        return thresholds;
    }

    /** Only the levels listed in {@code json}; blank input yields an empty map. */
    public Map<MetricIdentifier, ThresholdDefinition> parseOverrides(String json) {
        Map<MetricIdentifier, ThresholdDefinition> overrides = new EnumMap<>(MetricIdentifier.class);
        if (json == null || json.isBlank()) {
            return overrides;
        }
        for (JsonElement entry : metricsArray(json)) {
            applyEntry(entry, overrides, false);
        }
        return overrides;
    }

    private static JsonArray metricsArray(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new ThresholdsParseException("Failed to parse metrics thresholds JSON.", e);
        }
        if (root == null || !root.isJsonObject()
                || !root.getAsJsonObject().has("metrics")
                || !root.getAsJsonObject().get("metrics").isJsonArray()) {
            throw new ThresholdsParseException(
                    "Invalid thresholds JSON format. Expected object with 'metrics' array property.");
        }
        return root.getAsJsonObject().getAsJsonArray("metrics");
    }

    private void applyEntry(JsonElement element, Map<MetricIdentifier, ThresholdDefinition> target,
                            boolean fillAllLevels) {
        if (!element.isJsonObject()) {
            throw new ThresholdsParseException("Threshold entry must be an object: " + element);
        }
        JsonObject entry = element.getAsJsonObject();
        String name = stringOrNull(entry, "name");
        if (name == null || name.isBlank()) {
            throw new ThresholdsParseException("Threshold entry without 'name': " + entry);
        }
        MetricIdentifier metric = resolver.tryResolve(name).orElseThrow(() -> new ThresholdsParseException(
                "Unknown metric '" + name + "' in thresholds. Known metrics: " + MetricResolver.knownIdentifiers()));

        ThresholdDefinition existing = target.get(metric);
        MetricThreshold direction = existing != null && !existing.levels().isEmpty()
                ? existing.levels().values().iterator().next()
                : DefaultThresholds.defaultFor(metric);
        boolean higherIsBetter = booleanOr(entry, "higherIsBetter", direction.higherIsBetter());
        boolean positiveDeltaNeutral = booleanOr(entry, "positiveDeltaNeutral", direction.positiveDeltaNeutral());

        Map<SymbolLevel, MetricThreshold> levels = new EnumMap<>(SymbolLevel.class);
        if (existing != null) {
            existing.levels().forEach((level, threshold) ->
                    levels.put(level, threshold.withDirection(higherIsBetter, positiveDeltaNeutral)));
        }
        JsonElement symbolThresholds = entry.get("symbolThresholds");
        if (symbolThresholds != null && symbolThresholds.isJsonObject()) {
            for (Map.Entry<String, JsonElement> levelEntry : symbolThresholds.getAsJsonObject().entrySet()) {
                SymbolLevel level = SymbolLevel.fromLabel(levelEntry.getKey()).orElseThrow(() ->
                        new ThresholdsParseException("Unknown symbol level '" + levelEntry.getKey()
                                + "' for metric " + metric.id()));
                if (!levelEntry.getValue().isJsonObject()) continue;
                JsonObject cutoffs = levelEntry.getValue().getAsJsonObject();
                levels.put(level, new MetricThreshold(decimalOrNull(cutoffs, "warning"),
                        decimalOrNull(cutoffs, "error"), higherIsBetter, positiveDeltaNeutral));
            }
        }
        if (fillAllLevels) {
            for (SymbolLevel level : SymbolLevel.values()) {
                levels.putIfAbsent(level, new MetricThreshold(null, null, higherIsBetter, positiveDeltaNeutral));
            }
        }

        String description = stringOrNull(entry, "description");
        if (description == null || description.isBlank()) {
            description = existing != null ? existing.description() : null;
        }
        target.put(metric, new ThresholdDefinition(description, levels));
    }

    private static String stringOrNull(JsonObject object, String property) {
        JsonElement value = object.get(property);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            return null;
        }
        return value.getAsString();
    }

    private static boolean booleanOr(JsonObject object, String property, boolean fallback) {
        JsonElement value = object.get(property);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
            return fallback;
        }
        return value.getAsBoolean();
    }

    /** Non-numeric cutoffs read as "not set". */
    private static BigDecimal decimalOrNull(JsonObject object, String property) {
        JsonElement value = object.get(property);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return value.getAsBigDecimal();
    }

    public static class ThresholdsParseException extends RuntimeException {
        public ThresholdsParseException(String message) { super(message); }
        public ThresholdsParseException(String message, Throwable cause) { super(message, cause); }
    }
}
