package com.metricsfusion.core.model;

/** One reported occurrence of a static-analysis rule. */
public record RuleViolation(String message, String uri, Integer startLine, Integer endLine) {}
