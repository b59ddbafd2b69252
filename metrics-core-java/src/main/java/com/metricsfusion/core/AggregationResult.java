package com.metricsfusion.core;

import com.metricsfusion.core.merge.AggregationWarning;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.RuleDescription;
import com.metricsfusion.core.report.ReportModel;

import java.util.List;
import java.util.Map;

/**
 * Output of one aggregation run.
 *
 * @param solution          finished, evaluated tree
 * @param warnings          non-fatal problems, in the order they were found
 * @param ruleDescriptions  descriptions of the rules that occur in the tree
 * @param suppressedSymbols suppression entries that matched a symbol of the tree
 * @param report            the tree plus metadata, ready to write
 */
public record AggregationResult(
        MetricsNode solution,
        List<AggregationWarning> warnings,
        Map<String, RuleDescription> ruleDescriptions,
        List<ReportModel.SuppressedSymbolEntry> suppressedSymbols,
        ReportModel.Report report
) {}
