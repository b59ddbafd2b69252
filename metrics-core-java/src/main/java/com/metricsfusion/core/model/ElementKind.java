package com.metricsfusion.core.model;

import com.google.gson.annotations.SerializedName;

/** Kind of a flat parsed element, as emitted by format parsers. */
public enum ElementKind {
    @SerializedName("Assembly")  ASSEMBLY,
    @SerializedName("Namespace") NAMESPACE,
    @SerializedName("Type")      TYPE,
    @SerializedName("Member")    MEMBER
}
