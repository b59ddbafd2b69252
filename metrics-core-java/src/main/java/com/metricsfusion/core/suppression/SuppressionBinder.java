package com.metricsfusion.core.suppression;

import com.metricsfusion.core.config.MetricResolver;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.SuppressedSymbol;
import com.metricsfusion.core.normalize.SymbolNormalizer;
import com.metricsfusion.core.report.ReportModel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves suppression-list entries to (symbol, metric) pairs and lists the ones that hit a
 * symbol of the report. Nothing is removed from the tree; consumers read the list from the
 * report metadata.
 *
 * The metric of an entry is its explicit metric alias if given, else derived from the rule id:
 * the code-metric rules CA1501, CA1502, CA1505 and CA1506 map to the metric they guard, other
 * {@code IDE*} and {@code CA*} rules map to the matching violation counts.
 */
public class SuppressionBinder {

    private final MetricResolver resolver;

    public SuppressionBinder() {
        this(MetricResolver.builtIn());
    }

    public SuppressionBinder(MetricResolver resolver) {
        this.resolver = resolver != null ? resolver : MetricResolver.builtIn();
    }

    /** A validated suppression entry. */
    public record BoundSuppression(String fullyQualifiedName, MetricIdentifier metric, String ruleId,
                                   String justification, String filePath) {}

    /**
     * Validates every entry up front.
     *
     * @throws SuppressionBindingException for an entry without symbol, or whose metric cannot be
     *                                     resolved
     */
    public List<BoundSuppression> bind(List<SuppressedSymbol> entries) {
        List<BoundSuppression> result = new ArrayList<>();
        if (entries == null) {
            return result;
        }
        int index = 0;
        for (SuppressedSymbol entry : entries) {
            index++;
            if (entry == null || entry.fullyQualifiedName() == null || entry.fullyQualifiedName().isBlank()) {
                throw new SuppressionBindingException("Suppression entry #" + index + " has no fullyQualifiedName");
            }
            MetricIdentifier metric = resolveMetric(entry);
            result.add(new BoundSuppression(entry.fullyQualifiedName().trim(), metric, entry.ruleId(),
                    entry.justification(), entry.filePath()));
        }
        return result;
    }

    /**
     * Binds {@code entries} and returns metadata entries for those whose symbol exists in the
     * tree. Unmatched entries are reported on stderr.
     */
    public List<ReportModel.SuppressedSymbolEntry> apply(MetricsNode solution, List<SuppressedSymbol> entries) {
        List<BoundSuppression> bound = bind(entries);
        if (bound.isEmpty()) {
            return List.of();
        }
        Set<String> symbols = new HashSet<>();
        solution.walk(node -> {
            if (node.fullyQualifiedName() != null) {
                symbols.add(node.fullyQualifiedName());
                symbols.add(SymbolNormalizer.normalizeFullyQualifiedMethodName(node.fullyQualifiedName()));
            }
        });

        List<ReportModel.SuppressedSymbolEntry> result = new ArrayList<>();
        for (BoundSuppression suppression : bound) {
            String fqn = suppression.fullyQualifiedName();
            if (!symbols.contains(fqn) && !symbols.contains(SymbolNormalizer.normalizeFullyQualifiedMethodName(fqn))) {
                System.err.println("[metrics-fusion] WARNING: suppressed symbol not found in report: " + fqn);
                continue;
            }
            ReportModel.SuppressedSymbolEntry entry = new ReportModel.SuppressedSymbolEntry();
            entry.fullyQualifiedName = fqn;
            entry.metric = suppression.metric().id();
            entry.ruleId = suppression.ruleId();
            entry.justification = suppression.justification();
            entry.filePath = suppression.filePath();
            result.add(entry);
        }
        return result;
    }

    private MetricIdentifier resolveMetric(SuppressedSymbol entry) {
        if (entry.metric() != null && !entry.metric().isBlank()) {
            return resolver.tryResolve(entry.metric()).orElseThrow(() -> new SuppressionBindingException(
                    "Unknown metric '" + entry.metric() + "' for suppressed symbol " + entry.fullyQualifiedName()
                            + ". Known metrics: " + MetricResolver.knownIdentifiers()));
        }
        return metricForRule(entry.ruleId()).orElseThrow(() -> new SuppressionBindingException(
                "Cannot derive a metric for suppressed symbol " + entry.fullyQualifiedName()
                        + " from rule id '" + entry.ruleId() + "'"));
    }

    /** {@code CA1502:Avoid excessive complexity} and {@code ca1502} both read as CA1502. */
    static Optional<MetricIdentifier> metricForRule(String ruleId) {
        if (ruleId == null || ruleId.isBlank()) {
            return Optional.empty();
        }
        String normalized = ruleId.trim();
        int colon = normalized.indexOf(':');
        if (colon > 0) {
            normalized = normalized.substring(0, colon);
        }
        normalized = normalized.trim().toUpperCase(Locale.ROOT);
        MetricIdentifier codeMetric = switch (normalized) {
            case "CA1505" -> MetricIdentifier.MAINTAINABILITY_INDEX;
            case "CA1502" -> MetricIdentifier.CYCLOMATIC_COMPLEXITY;
            case "CA1506" -> MetricIdentifier.CLASS_COUPLING;
            case "CA1501" -> MetricIdentifier.DEPTH_OF_INHERITANCE;
            default -> null;
        };
        if (codeMetric != null) {
            return Optional.of(codeMetric);
        }
        if (normalized.startsWith("IDE")) {
            return Optional.of(MetricIdentifier.IDE_RULE_VIOLATIONS);
        }
        if (normalized.startsWith("CA")) {
            return Optional.of(MetricIdentifier.CA_RULE_VIOLATIONS);
        }
        return Optional.empty();
    }

    public static class SuppressionBindingException extends RuntimeException {
        public SuppressionBindingException(String message) { super(message); }
        public SuppressionBindingException(String message, Throwable cause) { super(message, cause); }
    }
}
