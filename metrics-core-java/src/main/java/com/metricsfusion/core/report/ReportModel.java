package com.metricsfusion.core.report;

import com.google.gson.annotations.SerializedName;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.RuleDescription;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * POJOs of report.json. The symbol tree itself is written by {@link MetricsNodeAdapter}.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class Report {
        @SerializedName("metadata") public Metadata metadata;
        @SerializedName("solution") public MetricsNode solution;
    }

    public static class Metadata {
        @SerializedName("generatedAt")       public String generatedAt;
        @SerializedName("metricDescriptors") public Map<String, MetricDescriptor> metricDescriptors;
        @SerializedName("thresholds")        public List<ThresholdEntry> thresholds;
        @SerializedName("ruleDescriptions")  public Map<String, RuleDescription> ruleDescriptions;
        @SerializedName("filters")           public FilterSettings filters;
        @SerializedName("suppressedSymbols") public List<SuppressedSymbolEntry> suppressedSymbols;
    }

    public static class MetricDescriptor {
        @SerializedName("unit")    public String unit;
        @SerializedName("aliases") public List<String> aliases;
    }

    /** Same shape as an entry of a threshold file, so the report can be fed back as one. */
    public static class ThresholdEntry {
        @SerializedName("name")                 public String name;
        @SerializedName("description")          public String description;
        @SerializedName("higherIsBetter")       public boolean higherIsBetter;
        @SerializedName("positiveDeltaNeutral") public boolean positiveDeltaNeutral;
        @SerializedName("symbolThresholds")     public Map<String, Cutoffs> symbolThresholds;
    }

    public static class Cutoffs {
        @SerializedName("warning") public BigDecimal warning;  // nullable
        @SerializedName("error")   public BigDecimal error;    // nullable
    }

    public static class FilterSettings {
        @SerializedName("excludedMembers")             public List<String> excludedMembers;
        @SerializedName("caseSensitiveMemberPatterns") public boolean caseSensitiveMemberPatterns;
        @SerializedName("excludedTypes")               public List<String> excludedTypes;
        @SerializedName("excludedAssemblies")          public List<String> excludedAssemblies;
        @SerializedName("excludeMethods")              public boolean excludeMethods;
        @SerializedName("excludeProperties")           public boolean excludeProperties;
        @SerializedName("excludeFields")               public boolean excludeFields;
        @SerializedName("excludeEvents")               public boolean excludeEvents;
    }

    public static class SuppressedSymbolEntry {
        @SerializedName("fullyQualifiedName") public String fullyQualifiedName;
        @SerializedName("metric")             public String metric;
        @SerializedName("ruleId")             public String ruleId;
        @SerializedName("justification")      public String justification;
        @SerializedName("filePath")           public String filePath;
    }
}
