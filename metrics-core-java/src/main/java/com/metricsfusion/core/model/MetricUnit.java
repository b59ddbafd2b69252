package com.metricsfusion.core.model;

import com.google.gson.annotations.SerializedName;

public enum MetricUnit {
    @SerializedName("percent") PERCENT("percent"),
    @SerializedName("count")   COUNT("count"),
    @SerializedName("score")   SCORE("score");

    private final String label;

    MetricUnit(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
