package com.metricsfusion.core.reconcile;

import com.metricsfusion.core.merge.MergeSession;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;

/**
 * Drops the branch-coverage reading of a type when it is empty or zero and none of the type's
 * members reports branch coverage. Coverage tools emit 0% for helper types that have no branch
 * points at all; an absent metric reads correctly, a zero does not.
 */
public final class TypeBranchCoverageApplicability {

    private TypeBranchCoverageApplicability() {}

    /** Returns the number of types that lost their branch-coverage reading. */
    public static int apply(MergeSession session) {
        int dropped = 0;
        for (MergeSession.TypeEntry entry : session.types()) {
            MetricsNode type = entry.node();
            MetricValue branch = type.metric(MetricIdentifier.BRANCH_COVERAGE);
            if (branch == null || branch.isNonZero()) continue;
            if (anyMemberHasBranchCoverage(type)) continue;

            type.removeMetric(MetricIdentifier.BRANCH_COVERAGE);
            dropped++;
        }
        return dropped;
    }

    private static boolean anyMemberHasBranchCoverage(MetricsNode type) {
        for (MetricsNode member : type.children()) {
            MetricValue value = member.metric(MetricIdentifier.BRANCH_COVERAGE);
            if (value != null && value.hasValue()) {
                return true;
            }
        }
        return false;
    }
}
