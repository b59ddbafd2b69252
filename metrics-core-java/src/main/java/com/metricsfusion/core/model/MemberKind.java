package com.metricsfusion.core.model;

import com.google.gson.annotations.SerializedName;

public enum MemberKind {
    @SerializedName("Unknown")  UNKNOWN,
    @SerializedName("Method")   METHOD,
    @SerializedName("Property") PROPERTY,
    @SerializedName("Field")    FIELD,
    @SerializedName("Event")    EVENT
}
