package com.metricsfusion.core.model;

import com.google.gson.annotations.SerializedName;

import java.util.Optional;

/**
 * Granularity a metric or threshold applies to.
 */
public enum SymbolLevel {
    @SerializedName("Solution")  SOLUTION("Solution"),
    @SerializedName("Assembly")  ASSEMBLY("Assembly"),
    @SerializedName("Namespace") NAMESPACE("Namespace"),
    @SerializedName("Type")      TYPE("Type"),
    @SerializedName("Member")    MEMBER("Member");

    private final String label;

    SymbolLevel(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** Case-insensitive lookup by label ("Type", "member", ...). */
    public static Optional<SymbolLevel> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (SymbolLevel level : values()) {
            if (level.label.equalsIgnoreCase(label.trim())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
