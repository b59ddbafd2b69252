package com.metricsfusion.core.model;

import com.google.gson.annotations.SerializedName;

/**
 * Tool family a parsed document came from.
 * Only {@link #COVERAGE} documents are checked against each other for duplicate symbols.
 */
public enum DocumentSource {
    @SerializedName("COVERAGE")     COVERAGE,
    @SerializedName("CODE_METRICS") CODE_METRICS,
    @SerializedName("FINDINGS")     FINDINGS
}
