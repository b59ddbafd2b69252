package com.metricsfusion.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Flat record a format parser emits for every symbol it sees.
 * Parent links are FQNs; the merge engine turns them into tree edges.
 *
 * @param kind                    element kind
 * @param name                    display name as reported by the tool
 * @param fullyQualifiedName      canonical FQN (nullable for assemblies and namespaces)
 * @param parentFullyQualifiedName FQN of the enclosing assembly, namespace or type (nullable)
 * @param containingAssemblyName  assembly name when the tool knows it (nullable)
 * @param memberKind              member kind; {@link MemberKind#UNKNOWN} for non-members
 * @param source                  file reference (nullable)
 * @param metrics                 metric readings, never containing null keys or values
 * @param hasFindings             element carries static-analysis findings; implied by a finding-count metric
 */
public record ParsedCodeElement(
        ElementKind kind,
        String name,
        String fullyQualifiedName,
        String parentFullyQualifiedName,
        String containingAssemblyName,
        MemberKind memberKind,
        SourceLocation source,
        Map<MetricIdentifier, MetricValue> metrics,
        boolean hasFindings
) {

    public ParsedCodeElement {
        if (memberKind == null) {
            memberKind = MemberKind.UNKNOWN;
        }
        EnumMap<MetricIdentifier, MetricValue> copy = new EnumMap<>(MetricIdentifier.class);
        if (metrics != null) {
            metrics.forEach((id, value) -> {
                if (id != null && value != null) {
                    copy.put(id, value);
                }
            });
        }
        metrics = Collections.unmodifiableMap(copy);
        hasFindings = hasFindings
                || copy.containsKey(MetricIdentifier.CA_RULE_VIOLATIONS)
                || copy.containsKey(MetricIdentifier.IDE_RULE_VIOLATIONS);
    }

    public static ParsedCodeElement assembly(String name) {
        return new ParsedCodeElement(ElementKind.ASSEMBLY, name, name, null, null, null, null, null, false);
    }

    public static ParsedCodeElement namespace(String name, String assemblyName) {
        return new ParsedCodeElement(ElementKind.NAMESPACE, name, name, assemblyName, assemblyName, null, null, null, false);
    }

    public static ParsedCodeElement type(String fullyQualifiedName, String parentNamespace, String assemblyName) {
        return new ParsedCodeElement(ElementKind.TYPE, simpleName(fullyQualifiedName), fullyQualifiedName,
                parentNamespace, assemblyName, null, null, null, false);
    }

    public static ParsedCodeElement member(String fullyQualifiedName, String parentType, String assemblyName) {
        return new ParsedCodeElement(ElementKind.MEMBER, null, fullyQualifiedName,
                parentType, assemblyName, MemberKind.METHOD, null, null, false);
    }

    public ParsedCodeElement withMetric(MetricIdentifier id, MetricValue value) {
        EnumMap<MetricIdentifier, MetricValue> next = new EnumMap<>(MetricIdentifier.class);
        next.putAll(metrics);
        next.put(id, value);
        return new ParsedCodeElement(kind, name, fullyQualifiedName, parentFullyQualifiedName,
                containingAssemblyName, memberKind, source, next, hasFindings);
    }

    public ParsedCodeElement withSource(SourceLocation location) {
        return new ParsedCodeElement(kind, name, fullyQualifiedName, parentFullyQualifiedName,
                containingAssemblyName, memberKind, location, metrics, hasFindings);
    }

    public ParsedCodeElement withMemberKind(MemberKind kindOfMember) {
        return new ParsedCodeElement(kind, name, fullyQualifiedName, parentFullyQualifiedName,
                containingAssemblyName, kindOfMember, source, metrics, hasFindings);
    }

    /** FQN if present, otherwise the display name. */
    public String identity() {
        return fullyQualifiedName != null && !fullyQualifiedName.isBlank() ? fullyQualifiedName : name;
    }

    private static String simpleName(String fqn) {
        if (fqn == null) {
            return null;
        }
        int lastDot = fqn.lastIndexOf('.');
        return lastDot >= 0 ? fqn.substring(lastDot + 1) : fqn;
    }
}
