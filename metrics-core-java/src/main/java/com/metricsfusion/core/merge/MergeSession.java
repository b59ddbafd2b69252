package com.metricsfusion.core.merge;

import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All lookup state of one aggregation run: the tree under construction plus FQN indexes
 * into it. One session per run; sessions share nothing.
 */
public final class MergeSession {

    /** A namespace node together with the assembly that owns it. */
    public record NamespaceEntry(MetricsNode node, MetricsNode assembly) {}

    /** A type node together with its owning namespace and assembly. */
    public record TypeEntry(MetricsNode node, MetricsNode namespace, MetricsNode assembly) {}

    /** A member node together with its declaring type. */
    public record MemberEntry(MetricsNode node, TypeEntry type) {}

    private final MetricsNode solution;
    private final Map<String, MetricsNode> assemblies = new LinkedHashMap<>();
    // key: "assembly::namespace"
    private final Map<String, NamespaceEntry> namespaces = new LinkedHashMap<>();
    private final Map<String, List<NamespaceEntry>> namespaceIndex = new LinkedHashMap<>();
    private final Map<String, TypeEntry> types = new LinkedHashMap<>();
    private final Map<String, MemberEntry> members = new LinkedHashMap<>();
    private final List<AggregationWarning> warnings = new ArrayList<>();

    public MergeSession(String solutionName) {
        this.solution = MetricsNode.solution(solutionName);
    }

    public MetricsNode solution() { return solution; }

    // --- assemblies ---

    public boolean hasAssembly(String name) {
        return assemblies.containsKey(name);
    }

    public MetricsNode getOrCreateAssembly(String name) {
        return assemblies.computeIfAbsent(name, key -> {
            MetricsNode node = new MetricsNode(NodeKind.ASSEMBLY, key, key);
            solution.addChild(node);
            return node;
        });
    }

    /** First assembly seen in this run, else the solution name. */
    public String defaultAssemblyName() {
        return assemblies.isEmpty() ? solution.name() : assemblies.keySet().iterator().next();
    }

    // --- namespaces ---

    public NamespaceEntry getOrCreateNamespace(String assemblyName, String namespaceName) {
        String key = assemblyName + "::" + namespaceName;
        NamespaceEntry existing = namespaces.get(key);
        if (existing != null) {
            return existing;
        }
        MetricsNode assembly = getOrCreateAssembly(assemblyName);
        MetricsNode node = new MetricsNode(NodeKind.NAMESPACE, namespaceName, namespaceName);
        assembly.addChild(node);
        NamespaceEntry entry = new NamespaceEntry(node, assembly);
        namespaces.put(key, entry);
        namespaceIndex.computeIfAbsent(namespaceName, k -> new ArrayList<>()).add(entry);
        return entry;
    }

    public Set<String> namespaceNames() {
        return Collections.unmodifiableSet(namespaceIndex.keySet());
    }

    /** Assembly of the first namespace registered under {@code namespaceName}. */
    public Optional<MetricsNode> assemblyOfNamespace(String namespaceName) {
        List<NamespaceEntry> entries = namespaceIndex.get(namespaceName);
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(0).assembly());
    }

    // --- types ---

    public Optional<TypeEntry> type(String fullyQualifiedName) {
        return Optional.ofNullable(types.get(fullyQualifiedName));
    }

    /** Snapshot of registered types in registration order. */
    public List<TypeEntry> types() {
        return List.copyOf(types.values());
    }

    public TypeEntry getOrCreateType(String assemblyName, String namespaceName, String fullyQualifiedName,
                                     String displayName) {
        TypeEntry existing = types.get(fullyQualifiedName);
        if (existing != null) {
            return existing;
        }
        NamespaceEntry namespace = getOrCreateNamespace(assemblyName, namespaceName);
        MetricsNode node = new MetricsNode(NodeKind.TYPE, displayName, fullyQualifiedName);
        namespace.node().addChild(node);
        TypeEntry entry = new TypeEntry(node, namespace.node(), namespace.assembly());
        types.put(fullyQualifiedName, entry);
        return entry;
    }

    /** Detaches a type and all of its members from the tree and the indexes. */
    public void removeType(TypeEntry entry) {
        for (MetricsNode member : entry.node().children()) {
            members.remove(member.fullyQualifiedName());
        }
        entry.namespace().removeChild(entry.node());
        types.remove(entry.node().fullyQualifiedName(), entry);
    }

    // --- members ---

    public Optional<MemberEntry> member(String fullyQualifiedName) {
        return Optional.ofNullable(members.get(fullyQualifiedName));
    }

    public MetricsNode getOrCreateMember(TypeEntry type, String fullyQualifiedName, String displayName) {
        MemberEntry existing = members.get(fullyQualifiedName);
        if (existing != null) {
            return existing.node();
        }
        MetricsNode node = new MetricsNode(NodeKind.MEMBER, displayName, fullyQualifiedName);
        type.node().addChild(node);
        members.put(fullyQualifiedName, new MemberEntry(node, type));
        return node;
    }

    public void removeMember(MemberEntry entry) {
        entry.type().node().removeChild(entry.node());
        members.remove(entry.node().fullyQualifiedName(), entry);
    }

    public List<MemberEntry> members() {
        return List.copyOf(members.values());
    }

    // --- diagnostics ---

    public void warn(String fullyQualifiedName, String sourcePath, String message) {
        AggregationWarning warning = new AggregationWarning(fullyQualifiedName, sourcePath, message);
        warnings.add(warning);
        System.err.println("[metrics-fusion] WARNING: " + warning);
    }

    public List<AggregationWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
