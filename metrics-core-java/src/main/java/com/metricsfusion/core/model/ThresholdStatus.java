package com.metricsfusion.core.model;

import com.google.gson.annotations.SerializedName;

public enum ThresholdStatus {
    @SerializedName("NotApplicable") NOT_APPLICABLE,
    @SerializedName("Success")       SUCCESS,
    @SerializedName("Warning")       WARNING,
    @SerializedName("Error")         ERROR
}
