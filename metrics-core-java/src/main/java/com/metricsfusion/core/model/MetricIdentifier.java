package com.metricsfusion.core.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Optional;

/**
 * Closed set of metrics the fusion core understands.
 * The JSON id is the key used in reports, parsed documents and threshold files.
 */
public enum MetricIdentifier {
    @SerializedName("AltCoverSequenceCoverage")
    SEQUENCE_COVERAGE("AltCoverSequenceCoverage", MetricUnit.PERCENT, "SequenceCoverage", "Coverage"),

    @SerializedName("AltCoverBranchCoverage")
    BRANCH_COVERAGE("AltCoverBranchCoverage", MetricUnit.PERCENT, "BranchCoverage"),

    @SerializedName("AltCoverCyclomaticComplexity")
    COVERAGE_CYCLOMATIC_COMPLEXITY("AltCoverCyclomaticComplexity", MetricUnit.COUNT, "CoverageComplexity"),

    @SerializedName("AltCoverNPathComplexity")
    NPATH_COMPLEXITY("AltCoverNPathComplexity", MetricUnit.COUNT, "NPath", "NPathComplexity"),

    @SerializedName("RoslynMaintainabilityIndex")
    MAINTAINABILITY_INDEX("RoslynMaintainabilityIndex", MetricUnit.SCORE, "MaintainabilityIndex", "MI"),

    @SerializedName("RoslynCyclomaticComplexity")
    CYCLOMATIC_COMPLEXITY("RoslynCyclomaticComplexity", MetricUnit.COUNT, "CyclomaticComplexity", "Complexity"),

    @SerializedName("RoslynClassCoupling")
    CLASS_COUPLING("RoslynClassCoupling", MetricUnit.COUNT, "ClassCoupling", "Coupling"),

    @SerializedName("RoslynDepthOfInheritance")
    DEPTH_OF_INHERITANCE("RoslynDepthOfInheritance", MetricUnit.COUNT, "DepthOfInheritance", "DIT"),

    @SerializedName("RoslynSourceLines")
    SOURCE_LINES("RoslynSourceLines", MetricUnit.COUNT, "SourceLines", "SLOC"),

    @SerializedName("RoslynExecutableLines")
    EXECUTABLE_LINES("RoslynExecutableLines", MetricUnit.COUNT, "ExecutableLines"),

    @SerializedName("SarifCaRuleViolations")
    CA_RULE_VIOLATIONS("SarifCaRuleViolations", MetricUnit.COUNT, "CaViolations", "CA"),

    @SerializedName("SarifIdeRuleViolations")
    IDE_RULE_VIOLATIONS("SarifIdeRuleViolations", MetricUnit.COUNT, "IdeViolations", "IDE");

    private final String id;
    private final MetricUnit unit;
    private final List<String> aliases;

    MetricIdentifier(String id, MetricUnit unit, String... aliases) {
        this.id = id;
        this.unit = unit;
        this.aliases = List.of(aliases);
    }

    /** The JSON key of this metric. */
    public String id() { return id; }

    public MetricUnit unit() { return unit; }

    /** Built-in short names accepted by configuration files. */
    public List<String> aliases() { return aliases; }

    /** Exact lookup by JSON id, as written by {@link #id()}. */
    public static Optional<MetricIdentifier> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (MetricIdentifier metric : values()) {
            if (metric.id.equals(id)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
