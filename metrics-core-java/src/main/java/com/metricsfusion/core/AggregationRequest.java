package com.metricsfusion.core;

import com.metricsfusion.core.evaluate.ThresholdTable;
import com.metricsfusion.core.filter.SymbolFilters;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.ParsedMetricsDocument;
import com.metricsfusion.core.model.SuppressedSymbol;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Everything one aggregation run needs.
 *
 * @param documents         parsed documents in submission order
 * @param solutionName      fallback solution name when no document carries one (nullable)
 * @param filters           exclusion rules
 * @param thresholds        report thresholds plus overrides
 * @param baseline          solution node of a previous report (nullable)
 * @param suppressedSymbols suppression list (nullable)
 * @param cancellation      polled between documents; returns true to stop
 */
public record AggregationRequest(
        List<ParsedMetricsDocument> documents,
        String solutionName,
        SymbolFilters filters,
        ThresholdTable thresholds,
        MetricsNode baseline,
        List<SuppressedSymbol> suppressedSymbols,
        BooleanSupplier cancellation
) {

    public AggregationRequest {
        filters = filters != null ? filters : SymbolFilters.none();
        thresholds = thresholds != null ? thresholds : ThresholdTable.defaults();
        suppressedSymbols = suppressedSymbols != null ? suppressedSymbols : List.of();
        cancellation = cancellation != null ? cancellation : () -> false;
    }

    /** Default thresholds, no filters, no baseline. */
    public static AggregationRequest of(List<ParsedMetricsDocument> documents) {
        return new AggregationRequest(documents, null, null, null, null, null, null);
    }

    public AggregationRequest withSolutionName(String name) {
        return new AggregationRequest(documents, name, filters, thresholds, baseline, suppressedSymbols, cancellation);
    }

    public AggregationRequest withFilters(SymbolFilters symbolFilters) {
        return new AggregationRequest(documents, solutionName, symbolFilters, thresholds, baseline, suppressedSymbols, cancellation);
    }

    public AggregationRequest withThresholds(ThresholdTable table) {
        return new AggregationRequest(documents, solutionName, filters, table, baseline, suppressedSymbols, cancellation);
    }

    public AggregationRequest withBaseline(MetricsNode baselineSolution) {
        return new AggregationRequest(documents, solutionName, filters, thresholds, baselineSolution, suppressedSymbols, cancellation);
    }

    public AggregationRequest withSuppressedSymbols(List<SuppressedSymbol> entries) {
        return new AggregationRequest(documents, solutionName, filters, thresholds, baseline, entries, cancellation);
    }

    public AggregationRequest withCancellation(BooleanSupplier cancelled) {
        return new AggregationRequest(documents, solutionName, filters, thresholds, baseline, suppressedSymbols, cancelled);
    }
}
