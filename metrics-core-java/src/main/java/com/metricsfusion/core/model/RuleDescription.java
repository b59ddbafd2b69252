package com.metricsfusion.core.model;

public record RuleDescription(String shortDescription, String category) {}
