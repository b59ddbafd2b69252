package com.metricsfusion.core.reconcile;

import com.metricsfusion.core.merge.MergeSession;
import com.metricsfusion.core.merge.NamespaceResolver;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.normalize.SymbolNormalizer;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Coverage tools name nested types {@code N.Outer+Inner} while code-metric tools name the same
 * type {@code N.Outer.Inner}. When both nodes exist this pass moves the coverage of the '+'
 * node onto the dotted one and removes the '+' node.
 *
 * Compiler-generated segments (anything with '<', '>' or "__") are left to
 * {@link IteratorCoverageReconciler}. Nothing is transferred when both sides already carry
 * coverage, either at type level or on a method of the same name.
 */
public final class NestedTypeNotationReconciler {

    private static final MetricIdentifier[] COVERAGE_METRICS = {
            MetricIdentifier.SEQUENCE_COVERAGE,
            MetricIdentifier.BRANCH_COVERAGE,
            MetricIdentifier.COVERAGE_CYCLOMATIC_COMPLEXITY,
            MetricIdentifier.NPATH_COMPLEXITY
    };

    private NestedTypeNotationReconciler() {}

    /** Returns the number of '+' types folded into their dotted counterpart. */
    public static int reconcile(MergeSession session) {
        int removed = 0;
        for (MergeSession.TypeEntry plusType : session.types()) {
            String dottedFqn = dottedName(plusType.node().fullyQualifiedName()).orElse(null);
            if (dottedFqn == null) continue;

            MergeSession.TypeEntry dotType = session.type(dottedFqn).orElse(null);
            if (dotType == null) continue;

            boolean plusCovered = CoverageTransfer.hasCoverage(plusType.node());
            boolean dotCovered = CoverageTransfer.hasCoverage(dotType.node());
            if ((plusCovered && dotCovered) || hasMethodConflict(plusType.node(), dotType.node())) {
                continue;
            }

            if (plusCovered) {
                copyCoverage(plusType.node(), dotType.node());
            }
            transferMembers(session, plusType, dotType);
            session.removeType(plusType);
            removed++;
        }
        return removed;
    }

    /**
     * {@code N.Outer+Inner} gives {@code N.Outer.Inner}. Empty when the name has no '+' or when a
     * segment looks compiler-generated.
     */
    static Optional<String> dottedName(String typeFqn) {
        if (typeFqn == null || typeFqn.isBlank()) {
            return Optional.empty();
        }
        String namespace = NamespaceResolver.sliceNamespace(typeFqn);
        String prefix = NamespaceResolver.GLOBAL_NAMESPACE.equals(namespace) ? "" : namespace + ".";
        if (!typeFqn.startsWith(prefix) || typeFqn.length() <= prefix.length()) {
            return Optional.empty();
        }
        String typePart = typeFqn.substring(prefix.length());
        if (typePart.indexOf('+') < 0) {
            return Optional.empty();
        }
        String[] segments = Arrays.stream(typePart.split("\\+"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
        if (segments.length < 2) {
            return Optional.empty();
        }
        for (String segment : segments) {
            if (segment.contains("<") || segment.contains(">") || segment.contains("__")) {
                return Optional.empty();
            }
        }
        return Optional.of(prefix + String.join(".", segments));
    }

    private static boolean hasMethodConflict(MetricsNode plusType, MetricsNode dotType) {
        if (plusType.children().isEmpty() || dotType.children().isEmpty()) {
            return false;
        }
        Map<String, MetricsNode> dotMethods = methodsByName(dotType);
        for (MetricsNode plusMember : plusType.children()) {
            MetricsNode dotMember = dotMethods.get(methodKey(plusMember));
            if (dotMember != null && CoverageTransfer.hasCoverage(plusMember) && CoverageTransfer.hasCoverage(dotMember)) {
                return true;
            }
        }
        return false;
    }

    private static void transferMembers(MergeSession session, MergeSession.TypeEntry plusType,
                                        MergeSession.TypeEntry dotType) {
        Map<String, MetricsNode> dotMethods = methodsByName(dotType.node());
        String plusFqn = plusType.node().fullyQualifiedName();
        String dotFqn = dotType.node().fullyQualifiedName();

        for (MetricsNode plusMember : plusType.node().children()) {
            String methodName = methodKey(plusMember);
            if (methodName == null || methodName.isBlank()) continue;
            if (!CoverageTransfer.hasCoverage(plusMember)) continue;

            MetricsNode dotMember = dotMethods.get(methodName);
            if (dotMember != null && CoverageTransfer.hasCoverage(dotMember)) continue;

            if (dotMember == null) {
                String memberFqn = rebaseMemberFqn(plusMember.fullyQualifiedName(), plusFqn, dotFqn, methodName);
                dotMember = session.getOrCreateMember(dotType, memberFqn, displayName(plusMember, methodName));
                dotMember.setMemberKind(plusMember.memberKind());
                dotMember.setSource(plusMember.source());
                dotMethods.put(methodName, dotMember);
            }
            copyCoverage(plusMember, dotMember);
            dotMember.markSynthesizedCoverage();
        }
    }

    private static void copyCoverage(MetricsNode source, MetricsNode target) {
        for (MetricIdentifier metric : COVERAGE_METRICS) {
            CoverageTransfer.copyIfAbsentOrZero(source, target, metric);
        }
    }

    /** First member wins when several overloads share a name. */
    private static Map<String, MetricsNode> methodsByName(MetricsNode type) {
        Map<String, MetricsNode> result = new LinkedHashMap<>();
        for (MetricsNode member : type.children()) {
            String name = methodKey(member);
            if (name != null && !name.isBlank()) {
                result.putIfAbsent(name, member);
            }
        }
        return result;
    }

    private static String methodKey(MetricsNode member) {
        String fqn = member.fullyQualifiedName();
        return SymbolNormalizer.extractMethodName(fqn != null && !fqn.isBlank() ? fqn : member.name());
    }

    private static String rebaseMemberFqn(String plusMemberFqn, String plusTypeFqn, String dotTypeFqn,
                                          String methodName) {
        if (plusMemberFqn != null && plusMemberFqn.startsWith(plusTypeFqn)
                && plusMemberFqn.length() > plusTypeFqn.length()) {
            return dotTypeFqn + plusMemberFqn.substring(plusTypeFqn.length());
        }
        return dotTypeFqn + "." + methodName + "(" + SymbolNormalizer.PARAMETER_PLACEHOLDER + ")";
    }

    private static String displayName(MetricsNode plusMember, String methodName) {
        String name = plusMember.name();
        return name != null && !name.isBlank() ? name : methodName;
    }
}
