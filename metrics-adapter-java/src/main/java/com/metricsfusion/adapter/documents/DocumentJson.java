package com.metricsfusion.adapter.documents;

import com.google.gson.annotations.SerializedName;
import com.metricsfusion.core.model.DocumentSource;
import com.metricsfusion.core.model.ElementKind;
import com.metricsfusion.core.model.MemberKind;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.RuleDescription;
import com.metricsfusion.core.model.SourceLocation;

import java.util.List;
import java.util.Map;

/**
 * Wire form of a parsed document as written by the format parsers. Metrics stay keyed by raw
 * string so unknown ids can be reported instead of failing the whole file.
 */
final class DocumentJson {

    private DocumentJson() {}

    static class Document {
        @SerializedName("solutionName")     String solutionName;
        @SerializedName("sourcePath")       String sourcePath;
        @SerializedName("source")           DocumentSource source;
        @SerializedName("elements")         List<Element> elements;
        @SerializedName("ruleDescriptions") Map<String, RuleDescription> ruleDescriptions;
    }

    static class Element {
        @SerializedName("kind")                     ElementKind kind;
        @SerializedName("name")                     String name;
        @SerializedName("fullyQualifiedName")       String fullyQualifiedName;
        @SerializedName("parentFullyQualifiedName") String parentFullyQualifiedName;
        @SerializedName("containingAssemblyName")   String containingAssemblyName;
        @SerializedName("memberKind")               MemberKind memberKind;
        @SerializedName("source")                   SourceLocation source;
        @SerializedName("metrics")                  Map<String, MetricValue> metrics;
        @SerializedName("hasFindings")              boolean hasFindings;
    }
}
