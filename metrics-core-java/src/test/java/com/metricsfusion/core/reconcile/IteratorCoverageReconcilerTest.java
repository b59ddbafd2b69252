package com.metricsfusion.core.reconcile;

import com.metricsfusion.core.merge.MergeSession;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IteratorCoverageReconcilerTest {

    private static final String OUTER = "N.Outer";
    private static final String STATE_MACHINE = "N.Outer+<Run>d__3";

    private static MergeSession session() {
        return new MergeSession("Sample");
    }

    private static MetricsNode addMember(MergeSession session, String typeFqn, String memberFqn) {
        MergeSession.TypeEntry type = session.getOrCreateType("Lib", "N", typeFqn, typeFqn.substring(2));
        return session.getOrCreateMember(type, memberFqn, memberFqn.substring(typeFqn.length() + 1));
    }

    private static MetricsNode addType(MergeSession session, String typeFqn) {
        return session.getOrCreateType("Lib", "N", typeFqn, typeFqn.substring(2)).node();
    }

    private static String value(MetricsNode node, MetricIdentifier metric) {
        MetricValue value = node.metric(metric);
        return value == null ? null : value.value.toPlainString();
    }

    @Test
    void coverageMovesFromStateMachineToDeclaringMethod() {
        MergeSession session = session();
        MetricsNode run = addMember(session, OUTER, "N.Outer.Run(...)");
        run.putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(0));
        run.putMetric(MetricIdentifier.BRANCH_COVERAGE, MetricValue.of(0));
        MetricsNode iterator = addType(session, STATE_MACHINE);
        iterator.putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(80));
        iterator.putMetric(MetricIdentifier.BRANCH_COVERAGE, MetricValue.of(50));
        iterator.putMetric(MetricIdentifier.COVERAGE_CYCLOMATIC_COMPLEXITY, MetricValue.of(4));

        int removed = IteratorCoverageReconciler.reconcile(session);

        assertEquals(1, removed);
        assertTrue(session.type(STATE_MACHINE).isEmpty());
        assertEquals("80", value(run, MetricIdentifier.SEQUENCE_COVERAGE));
        assertEquals("50", value(run, MetricIdentifier.BRANCH_COVERAGE));
        assertEquals("4", value(run, MetricIdentifier.COVERAGE_CYCLOMATIC_COMPLEXITY));
        assertTrue(run.includesSynthesizedCoverage());
    }

    @Test
    void branchCoverageNotAddedToMethodWithoutBranchReading() {
        MergeSession session = session();
        MetricsNode run = addMember(session, OUTER, "N.Outer.Run(...)");
        run.putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(0));
        MetricsNode iterator = addType(session, STATE_MACHINE);
        iterator.putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(100));
        iterator.putMetric(MetricIdentifier.BRANCH_COVERAGE, MetricValue.of(75));

        IteratorCoverageReconciler.reconcile(session);

        assertEquals("100", value(run, MetricIdentifier.SEQUENCE_COVERAGE));
        assertFalse(run.hasMetric(MetricIdentifier.BRANCH_COVERAGE));
    }

    @Test
    void uncoveredStateMachineRemovedAsNoise() {
        MergeSession session = session();
        MetricsNode run = addMember(session, OUTER, "N.Outer.Run(...)");
        run.putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(0));
        addMember(session, STATE_MACHINE, STATE_MACHINE + ".MoveNext(...)");

        int removed = IteratorCoverageReconciler.reconcile(session);

        assertEquals(1, removed);
        assertTrue(session.type(STATE_MACHINE).isEmpty());
        assertTrue(session.member(STATE_MACHINE + ".MoveNext(...)").isEmpty());
        assertFalse(run.includesSynthesizedCoverage());
    }

    @Test
    void bothCoveredLeavesTreeUntouched() {
        MergeSession session = session();
        MetricsNode run = addMember(session, OUTER, "N.Outer.Run(...)");
        run.putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(60));
        addType(session, STATE_MACHINE).putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(90));

        assertEquals(0, IteratorCoverageReconciler.reconcile(session));
        assertTrue(session.type(STATE_MACHINE).isPresent());
        assertEquals("60", value(run, MetricIdentifier.SEQUENCE_COVERAGE));
    }

    @Test
    void onlyMethodCoveredKeepsStateMachine() {
        MergeSession session = session();
        addMember(session, OUTER, "N.Outer.Run(...)").putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(60));
        addType(session, STATE_MACHINE).putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(0));

        assertEquals(0, IteratorCoverageReconciler.reconcile(session));
        assertTrue(session.type(STATE_MACHINE).isPresent());
    }

    @Test
    void secondRunChangesNothing() {
        MergeSession session = session();
        MetricsNode run = addMember(session, OUTER, "N.Outer.Run(...)");
        addType(session, STATE_MACHINE).putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(70));

        IteratorCoverageReconciler.reconcile(session);
        int typesAfterFirst = session.types().size();

        assertEquals(0, IteratorCoverageReconciler.reconcile(session));
        assertEquals(typesAfterFirst, session.types().size());
        assertEquals("70", value(run, MetricIdentifier.SEQUENCE_COVERAGE));
    }

    @Test
    void stateMachineWithoutOuterMethodIsKept() {
        MergeSession session = session();
        addType(session, OUTER);
        addType(session, STATE_MACHINE).putMetric(MetricIdentifier.SEQUENCE_COVERAGE, MetricValue.of(70));

        assertEquals(0, IteratorCoverageReconciler.reconcile(session));
        assertTrue(session.type(STATE_MACHINE).isPresent());
    }

    @Test
    void stateMachineNamesRecognised() {
        IteratorCoverageReconciler.StateMachineName parsed =
                IteratorCoverageReconciler.parse("N.Outer+<Run>d__3").orElseThrow();
        assertEquals("N.Outer", parsed.outerType());
        assertEquals("Run", parsed.methodName());

        assertEquals("N.A+B", IteratorCoverageReconciler.parse("N.A+B+<LoadAsync>d__12").orElseThrow().outerType());
    }

    @Test
    void otherNamesRejected() {
        assertTrue(IteratorCoverageReconciler.parse(null).isEmpty());
        assertTrue(IteratorCoverageReconciler.parse("N.Outer+Inner").isEmpty());
        assertTrue(IteratorCoverageReconciler.parse("N.Outer+<Run>d__").isEmpty());
        assertTrue(IteratorCoverageReconciler.parse("N.Outer+<Run>d__x1").isEmpty());
        assertTrue(IteratorCoverageReconciler.parse("N.Outer+<>d__3").isEmpty());
        assertTrue(IteratorCoverageReconciler.parse("N.Outer+<>c").isEmpty());
        assertTrue(IteratorCoverageReconciler.parse("N.Outer+").isEmpty());
    }
}
