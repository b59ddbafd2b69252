package com.metricsfusion.core.config;

import com.metricsfusion.core.model.MetricIdentifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves the metric names found in configuration: JSON ids ({@code RoslynCyclomaticComplexity}),
 * enum constant names ({@code CYCLOMATIC_COMPLEXITY}), built-in aliases ({@code Complexity}) and
 * user-configured aliases. Matching is case-insensitive.
 */
public final class MetricResolver {

    private static final MetricResolver BUILT_IN = new MetricResolver(Map.of());

    private final Map<String, MetricIdentifier> byName = new LinkedHashMap<>();
    private final Map<MetricIdentifier, List<String>> customAliases = new EnumMap<>(MetricIdentifier.class);

    /**
     * @param aliases extra aliases per metric; blanks and duplicates are dropped, entries equal to
     *                a metric's own id or constant name are ignored
     * @throws IllegalArgumentException when one alias is claimed by two metrics
     */
    public MetricResolver(Map<MetricIdentifier, List<String>> aliases) {
        for (MetricIdentifier metric : MetricIdentifier.values()) {
            byName.put(key(metric.id()), metric);
            byName.put(key(metric.name()), metric);
        }
        for (MetricIdentifier metric : MetricIdentifier.values()) {
            for (String alias : metric.aliases()) {
                register(alias, metric);
            }
        }
        if (aliases == null) {
            return;
        }
        aliases.forEach((metric, names) -> {
            if (metric == null || names == null) return;
            List<String> accepted = new ArrayList<>();
            for (String raw : names) {
                if (raw == null || raw.isBlank()) continue;
                String alias = raw.trim();
                if (isOwnIdentifier(alias, metric)) continue;
                if (accepted.stream().anyMatch(a -> a.equalsIgnoreCase(alias))) continue;
                register(alias, metric);
                accepted.add(alias);
            }
            if (!accepted.isEmpty()) {
                customAliases.put(metric, List.copyOf(accepted));
            }
        });
    }

    /** Resolver that knows only the built-in names. */
    public static MetricResolver builtIn() {
        return BUILT_IN;
    }

    public Optional<MetricIdentifier> tryResolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(key(name.trim())));
    }

    /**
     * @throws IllegalArgumentException naming the known identifiers when {@code name} is unknown
     */
    public MetricIdentifier resolve(String name) {
        return tryResolve(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown metric '" + name + "'. Known metrics: " + knownIdentifiers()));
    }

    /** User-configured aliases that survived cleanup, per metric. */
    public Map<MetricIdentifier, List<String>> customAliases() {
        return Collections.unmodifiableMap(customAliases);
    }

    public static String knownIdentifiers() {
        return Arrays.stream(MetricIdentifier.values())
                .map(MetricIdentifier::id)
                .collect(Collectors.joining(", "));
    }

    private void register(String alias, MetricIdentifier metric) {
        MetricIdentifier existing = byName.get(key(alias));
        if (existing != null && existing != metric) {
            throw new IllegalArgumentException(
                    "Alias '" + alias + "' is already used by metric " + existing.id());
        }
        byName.put(key(alias), metric);
    }

    private static boolean isOwnIdentifier(String alias, MetricIdentifier metric) {
        return alias.equalsIgnoreCase(metric.id()) || alias.equalsIgnoreCase(metric.name());
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
