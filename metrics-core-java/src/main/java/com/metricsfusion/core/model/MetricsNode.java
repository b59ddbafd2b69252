package com.metricsfusion.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * One node of the fused symbol tree. A single class covers all five kinds; the
 * {@link NodeKind} tag decides which kind of children the node may own.
 *
 * Member-only state ({@code memberKind}, {@code includesSynthesizedCoverage},
 * {@code hasFindings}) cannot be set on other kinds.
 */
public final class MetricsNode {

    private final NodeKind kind;
    private final String name;
    private final String fullyQualifiedName;
    private final EnumMap<MetricIdentifier, MetricValue> metrics = new EnumMap<>(MetricIdentifier.class);
    private final List<MetricsNode> children = new ArrayList<>();
    private SourceLocation source;
    private MemberKind memberKind;
    private boolean includesSynthesizedCoverage;
    private boolean hasFindings;
    private boolean isNew;

    public MetricsNode(NodeKind kind, String name, String fullyQualifiedName) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.fullyQualifiedName = fullyQualifiedName;
        this.memberKind = kind == NodeKind.MEMBER ? MemberKind.UNKNOWN : null;
    }

    public static MetricsNode solution(String name) {
        return new MetricsNode(NodeKind.SOLUTION, name, name);
    }

    public NodeKind kind()                { return kind; }
    public String name()                  { return name; }
    public String fullyQualifiedName()    { return fullyQualifiedName; }
    public SourceLocation source()        { return source; }
    public MemberKind memberKind()        { return memberKind; }
    public boolean includesSynthesizedCoverage() { return includesSynthesizedCoverage; }
    public boolean hasFindings()          { return hasFindings; }
    public boolean isNew()                { return isNew; }

    public void setSource(SourceLocation source) { this.source = source; }
    public void setNew(boolean isNew)            { this.isNew = isNew; }

    public void setMemberKind(MemberKind memberKind) {
        requireMember("memberKind");
        this.memberKind = memberKind != null ? memberKind : MemberKind.UNKNOWN;
    }

    public void markSynthesizedCoverage() {
        requireMember("includesSynthesizedCoverage");
        this.includesSynthesizedCoverage = true;
    }

    public void markFindings() {
        requireMember("hasFindings");
        this.hasFindings = true;
    }

    // --- metrics ---

    public Map<MetricIdentifier, MetricValue> metrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public MetricValue metric(MetricIdentifier id) {
        return metrics.get(id);
    }

    public boolean hasMetric(MetricIdentifier id) {
        return metrics.containsKey(id);
    }

    public void putMetric(MetricIdentifier id, MetricValue value) {
        metrics.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(value, "value"));
    }

    public MetricValue removeMetric(MetricIdentifier id) {
        return metrics.remove(id);
    }

    /** Replaces all metrics at once; null values are not stored. */
    public void replaceMetrics(Map<MetricIdentifier, MetricValue> replacement) {
        metrics.clear();
        replacement.forEach((id, value) -> {
            if (value != null) {
                metrics.put(id, value);
            }
        });
    }

    // --- children ---

    public List<MetricsNode> children() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(MetricsNode child) {
        NodeKind expected = kind.childKind()
                .orElseThrow(() -> new IllegalArgumentException(kind.label() + " nodes have no children"));
        if (child.kind != expected) {
            throw new IllegalArgumentException(
                    kind.label() + " node cannot own a " + child.kind.label() + " node: " + child.fullyQualifiedName);
        }
        children.add(child);
    }

    /** Removes {@code child} by identity. */
    public boolean removeChild(MetricsNode child) {
        return children.removeIf(c -> c == child);
    }

    public Optional<MetricsNode> findChild(String fullyQualifiedName) {
        return children.stream()
                .filter(c -> Objects.equals(c.fullyQualifiedName, fullyQualifiedName))
                .findFirst();
    }

    /** Pre-order walk over this node and all descendants. */
    public void walk(Consumer<MetricsNode> visitor) {
        visitor.accept(this);
        for (MetricsNode child : List.copyOf(children)) {
            child.walk(visitor);
        }
    }

    /** All descendants of the given kind, in tree order. */
    public List<MetricsNode> descendants(NodeKind target) {
        List<MetricsNode> result = new ArrayList<>();
        walk(node -> {
            if (node.kind == target) {
                result.add(node);
            }
        });
        return result;
    }

    private void requireMember(String property) {
        if (kind != NodeKind.MEMBER) {
            throw new IllegalStateException(property + " only applies to member nodes, not " + kind.label());
        }
    }

    @Override
    public String toString() {
        return kind.label() + "(" + fullyQualifiedName + ")";
    }
}
