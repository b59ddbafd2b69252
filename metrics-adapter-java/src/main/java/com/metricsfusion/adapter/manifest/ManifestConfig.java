package com.metricsfusion.adapter.manifest;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Deserialized form of run.json. Relative paths are resolved against the directory holding
 * the manifest.
 */
public class ManifestConfig {

    @SerializedName("solution_name")
    private String solutionName;

    /** Parsed-document JSON files, merged in this order. */
    @SerializedName("documents")
    private List<String> documents;

    @SerializedName("thresholds")
    private String thresholds;

    /** Optional per-run threshold overrides, same format as {@code thresholds}. */
    @SerializedName("threshold_overrides")
    private String thresholdOverrides;

    /** Previous report.json used for deltas. Overridden by --baseline. */
    @SerializedName("baseline")
    private String baseline;

    @SerializedName("suppressed_symbols")
    private String suppressedSymbols;

    /** Comma- or semicolon-separated member name patterns. */
    @SerializedName("excluded_members")
    private String excludedMembers;

    @SerializedName("excluded_types")
    private String excludedTypes;

    @SerializedName("excluded_assemblies")
    private String excludedAssemblies;

    @SerializedName("exclude_methods")
    private Boolean excludeMethods;

    @SerializedName("exclude_properties")
    private Boolean excludeProperties;

    @SerializedName("exclude_fields")
    private Boolean excludeFields;

    @SerializedName("exclude_events")
    private Boolean excludeEvents;

    /** Member patterns match case-sensitively unless set to false (default: true). */
    @SerializedName("case_sensitive_member_patterns")
    private Boolean caseSensitiveMemberPatterns;

    /** Extra metric aliases, keyed by metric id or alias. */
    @SerializedName("metric_aliases")
    private Map<String, List<String>> metricAliases;

    public String getSolutionName()       { return solutionName; }
    public List<String> getDocuments()    { return documents != null ? documents : Collections.emptyList(); }
    public String getThresholds()         { return thresholds; }
    public String getThresholdOverrides() { return thresholdOverrides; }
    public String getBaseline()           { return baseline; }
    public String getSuppressedSymbols()  { return suppressedSymbols; }
    public String getExcludedMembers()    { return excludedMembers; }
    public String getExcludedTypes()      { return excludedTypes; }
    public String getExcludedAssemblies() { return excludedAssemblies; }
    public boolean isExcludeMethods()     { return excludeMethods != null && excludeMethods; }
    public boolean isExcludeProperties()  { return excludeProperties != null && excludeProperties; }
    public boolean isExcludeFields()      { return excludeFields != null && excludeFields; }
    public boolean isExcludeEvents()      { return excludeEvents != null && excludeEvents; }
    public boolean isCaseSensitiveMemberPatterns() {
        return caseSensitiveMemberPatterns == null || caseSensitiveMemberPatterns;
    }
    public Map<String, List<String>> getMetricAliases() {
        return metricAliases != null ? metricAliases : Collections.emptyMap();
    }
}
