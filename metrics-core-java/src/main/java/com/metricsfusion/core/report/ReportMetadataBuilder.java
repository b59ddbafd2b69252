package com.metricsfusion.core.report;

import com.metricsfusion.core.evaluate.MetricThreshold;
import com.metricsfusion.core.evaluate.ThresholdDefinition;
import com.metricsfusion.core.evaluate.ThresholdTable;
import com.metricsfusion.core.filter.SymbolFilters;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.RuleDescription;
import com.metricsfusion.core.model.SymbolLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the {@code metadata} block of a report from the settings of one run.
 */
public class ReportMetadataBuilder {

    private ThresholdTable thresholds = ThresholdTable.empty();
    private SymbolFilters filters = SymbolFilters.none();
    private Map<String, RuleDescription> ruleDescriptions = Map.of();
    private List<ReportModel.SuppressedSymbolEntry> suppressedSymbols = List.of();
    private Instant generatedAt = Instant.now();

    public ReportMetadataBuilder thresholds(ThresholdTable table) {
        this.thresholds = table != null ? table : ThresholdTable.empty();
        return this;
    }

    public ReportMetadataBuilder filters(SymbolFilters symbolFilters) {
        this.filters = symbolFilters != null ? symbolFilters : SymbolFilters.none();
        return this;
    }

    public ReportMetadataBuilder ruleDescriptions(Map<String, RuleDescription> descriptions) {
        this.ruleDescriptions = descriptions != null ? descriptions : Map.of();
        return this;
    }

    public ReportMetadataBuilder suppressedSymbols(List<ReportModel.SuppressedSymbolEntry> entries) {
        this.suppressedSymbols = entries != null ? entries : List.of();
        return this;
    }

    public ReportMetadataBuilder generatedAt(Instant instant) {
        this.generatedAt = instant != null ? instant : Instant.now();
        return this;
    }

    public ReportModel.Metadata build() {
        ReportModel.Metadata metadata = new ReportModel.Metadata();
        metadata.generatedAt = generatedAt.toString();
        metadata.metricDescriptors = metricDescriptors();
        metadata.thresholds = thresholdEntries();
        // sorted so the output does not depend on document order
        metadata.ruleDescriptions = new TreeMap<>(ruleDescriptions);
        metadata.filters = filterSettings();
        metadata.suppressedSymbols = new ArrayList<>(suppressedSymbols);
        return metadata;
    }

    private static Map<String, ReportModel.MetricDescriptor> metricDescriptors() {
        Map<String, ReportModel.MetricDescriptor> result = new LinkedHashMap<>();
        for (MetricIdentifier metric : MetricIdentifier.values()) {
            ReportModel.MetricDescriptor descriptor = new ReportModel.MetricDescriptor();
            descriptor.unit = metric.unit().label();
            descriptor.aliases = metric.aliases();
            result.put(metric.id(), descriptor);
        }
        return result;
    }

    private List<ReportModel.ThresholdEntry> thresholdEntries() {
        List<ReportModel.ThresholdEntry> result = new ArrayList<>();
        for (Map.Entry<MetricIdentifier, ThresholdDefinition> entry : thresholds.effective().entrySet()) {
            ThresholdDefinition definition = entry.getValue();
            if (definition.levels().isEmpty()) continue;

            MetricThreshold first = definition.levels().values().iterator().next();
            ReportModel.ThresholdEntry json = new ReportModel.ThresholdEntry();
            json.name = entry.getKey().id();
            json.description = definition.description();
            json.higherIsBetter = first.higherIsBetter();
            json.positiveDeltaNeutral = first.positiveDeltaNeutral();
            json.symbolThresholds = new LinkedHashMap<>();
            for (Map.Entry<SymbolLevel, MetricThreshold> level : definition.levels().entrySet()) {
                ReportModel.Cutoffs cutoffs = new ReportModel.Cutoffs();
                cutoffs.warning = level.getValue().warning();
                cutoffs.error = level.getValue().error();
                json.symbolThresholds.put(level.getKey().label(), cutoffs);
            }
            result.add(json);
        }
        return result;
    }

    private ReportModel.FilterSettings filterSettings() {
        ReportModel.FilterSettings settings = new ReportModel.FilterSettings();
        settings.excludedMembers = filters.members().patterns().patterns();
        settings.caseSensitiveMemberPatterns = filters.members().patterns().caseSensitive();
        settings.excludedTypes = filters.types().patterns().patterns();
        settings.excludedAssemblies = filters.assemblies().patterns().patterns();
        settings.excludeMethods = filters.memberKinds().excludeMethods();
        settings.excludeProperties = filters.memberKinds().excludeProperties();
        settings.excludeFields = filters.memberKinds().excludeFields();
        settings.excludeEvents = filters.memberKinds().excludeEvents();
        return settings;
    }
}
