package com.metricsfusion.core.reconcile;

import com.metricsfusion.core.merge.MergeSession;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeBranchCoverageApplicabilityTest {

    @Test
    void zeroBranchCoverageDroppedWhenNoMemberHasBranches() {
        MergeSession session = new MergeSession("Sample");
        MergeSession.TypeEntry type = session.getOrCreateType("Lib", "N", "N.Helper", "Helper");
        type.node().putMetric(MetricIdentifier.BRANCH_COVERAGE, MetricValue.of(0));
        session.getOrCreateMember(type, "N.Helper.Get(...)", "Get")
                .putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(100));

        assertEquals(1, TypeBranchCoverageApplicability.apply(session));
        assertFalse(type.node().hasMetric(MetricIdentifier.BRANCH_COVERAGE));
    }

    @Test
    void zeroKeptWhenAMemberReportsBranches() {
        MergeSession session = new MergeSession("Sample");
        MergeSession.TypeEntry type = session.getOrCreateType("Lib", "N", "N.Worker", "Worker");
        type.node().putMetric(MetricIdentifier.BRANCH_COVERAGE, MetricValue.of(0));
        MetricsNode member = session.getOrCreateMember(type, "N.Worker.Run(...)", "Run");
        member.putMetric(MetricIdentifier.BRANCH_COVERAGE, MetricValue.of(0));

        assertEquals(0, TypeBranchCoverageApplicability.apply(session));
        assertTrue(type.node().hasMetric(MetricIdentifier.BRANCH_COVERAGE));
    }

    @Test
    void nonZeroBranchCoverageKept() {
        MergeSession session = new MergeSession("Sample");
        MergeSession.TypeEntry type = session.getOrCreateType("Lib", "N", "N.Worker", "Worker");
        type.node().putMetric(MetricIdentifier.BRANCH_COVERAGE, MetricValue.of(40));

        assertEquals(0, TypeBranchCoverageApplicability.apply(session));
        assertTrue(type.node().hasMetric(MetricIdentifier.BRANCH_COVERAGE));
    }
}
