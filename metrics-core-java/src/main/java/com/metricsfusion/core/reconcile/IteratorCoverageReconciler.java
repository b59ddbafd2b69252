package com.metricsfusion.core.reconcile;

import com.metricsfusion.core.merge.MergeSession;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.normalize.SymbolNormalizer;

import java.util.Optional;

/**
 * Folds coverage recorded on compiler-generated iterator and async state machines
 * ({@code N.Outer+<Run>d__3}) back onto the method that declared them ({@code N.Outer.Run(...)}).
 *
 * <ul>
 *   <li>neither side covered: the state machine is noise and is removed</li>
 *   <li>both covered: nothing happens</li>
 *   <li>only the state machine covered: its coverage moves to the method and the state machine
 *       is removed</li>
 * </ul>
 * Branch coverage is only moved onto methods that already own a branch-coverage reading, so a
 * method without branch points never reports a misleading 0%.
 */
public final class IteratorCoverageReconciler {

    /** Outer type FQN and logical method name parsed from a state machine type FQN. */
    record StateMachineName(String outerType, String methodName) {}

    private IteratorCoverageReconciler() {}

    /** Returns the number of state machine types removed from the tree. */
    public static int reconcile(MergeSession session) {
        int removed = 0;
        for (MergeSession.TypeEntry candidate : session.types()) {
            StateMachineName parsed = parse(candidate.node().fullyQualifiedName()).orElse(null);
            if (parsed == null) continue;

            MergeSession.TypeEntry outer = session.type(parsed.outerType()).orElse(null);
            if (outer == null) continue;

            MetricsNode member = findMember(outer.node(), parsed.methodName());
            if (member == null) continue;

            boolean iteratorCovered = CoverageTransfer.hasCoverage(candidate.node());
            boolean memberCovered = CoverageTransfer.hasCoverage(member);
            if (iteratorCovered && memberCovered) {
                continue;
            }
            if (!iteratorCovered && !memberCovered) {
                session.removeType(candidate);
                removed++;
                continue;
            }
            if (iteratorCovered) {
                transfer(candidate.node(), member);
                session.removeType(candidate);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Recognises {@code Outer+<Method>d__N}: the segment after the last '+' starts with '<',
     * closes its method name before the end, and ends with {@code d__} followed by digits.
     */
    static Optional<StateMachineName> parse(String typeFqn) {
        if (typeFqn == null) {
            return Optional.empty();
        }
        int plus = typeFqn.lastIndexOf('+');
        if (plus <= 0 || plus == typeFqn.length() - 1) {
            return Optional.empty();
        }
        String segment = typeFqn.substring(plus + 1);
        if (segment.charAt(0) != '<') {
            return Optional.empty();
        }
        int close = segment.indexOf('>');
        if (close <= 1 || close == segment.length() - 1) {
            return Optional.empty();
        }
        if (!hasStateMachineSuffix(segment.substring(close + 1))) {
            return Optional.empty();
        }
        return Optional.of(new StateMachineName(typeFqn.substring(0, plus), segment.substring(1, close)));
    }

    private static boolean hasStateMachineSuffix(String suffix) {
        if (!suffix.startsWith("d__") || suffix.length() == 3) {
            return false;
        }
        for (int i = 3; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static MetricsNode findMember(MetricsNode type, String methodName) {
        for (MetricsNode member : type.children()) {
            if (methodName.equals(SymbolNormalizer.extractMethodName(member.fullyQualifiedName()))) {
                return member;
            }
        }
        return null;
    }

    private static void transfer(MetricsNode stateMachine, MetricsNode member) {
        CoverageTransfer.copyIfAbsentOrZero(stateMachine, member, MetricIdentifier.SEQUENCE_COVERAGE);
        if (member.hasMetric(MetricIdentifier.BRANCH_COVERAGE)) {
            CoverageTransfer.copyIfAbsentOrZero(stateMachine, member, MetricIdentifier.BRANCH_COVERAGE);
        }
        CoverageTransfer.copyIfAbsentOrZero(stateMachine, member, MetricIdentifier.COVERAGE_CYCLOMATIC_COMPLEXITY);
        CoverageTransfer.copyIfAbsentOrZero(stateMachine, member, MetricIdentifier.NPATH_COMPLEXITY);
        member.markSynthesizedCoverage();
    }
}
