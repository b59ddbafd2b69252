package com.metricsfusion.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-rule share of a finding-count metric.
 */
public class RuleBreakdownEntry {

    public int count;
    public List<RuleViolation> violations = new ArrayList<>();

    public RuleBreakdownEntry() {}

    public RuleBreakdownEntry(int count, List<RuleViolation> violations) {
        this.count = count;
        this.violations = violations != null ? new ArrayList<>(violations) : new ArrayList<>();
    }

    public List<RuleViolation> getViolations() {
        return violations != null ? violations : List.of();
    }

    public RuleBreakdownEntry copy() {
        return new RuleBreakdownEntry(count, getViolations());
    }
}
