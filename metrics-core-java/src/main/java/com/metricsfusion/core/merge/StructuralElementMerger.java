package com.metricsfusion.core.merge;

import com.metricsfusion.core.filter.SymbolFilters;
import com.metricsfusion.core.model.ElementKind;
import com.metricsfusion.core.model.MemberKind;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.ParsedCodeElement;
import com.metricsfusion.core.model.ParsedMetricsDocument;
import com.metricsfusion.core.normalize.SymbolNormalizer;

/**
 * Folds the flat elements of one document into the session tree.
 *
 * Symbols are identified by FQN; a symbol seen for the first time is appended to its parent's
 * children, a known one has its metrics and source merged via {@link MetricMerger}.
 * Documents must be merged one at a time in submission order because namespace inference
 * depends on the namespaces registered so far.
 */
public class StructuralElementMerger {

    private final MergeSession session;
    private final SymbolFilters filters;

    public StructuralElementMerger(MergeSession session, SymbolFilters filters) {
        this.session = session;
        this.filters = filters != null ? filters : SymbolFilters.none();
    }

    public void merge(ParsedMetricsDocument document) {
        String sourcePath = document.sourcePath();
        for (ParsedCodeElement element : document.elements()) {
            if (element == null) {
                session.warn(null, sourcePath, "Null element skipped");
                continue;
            }
            String problem = validate(element);
            if (problem != null) {
                session.warn(element.identity(), sourcePath, problem);
                continue;
            }
            switch (element.kind()) {
                case ASSEMBLY  -> mergeAssembly(element);
                case NAMESPACE -> mergeNamespace(element);
                case TYPE      -> mergeType(element);
                case MEMBER    -> mergeMember(element, sourcePath);
            }
        }
    }

    /** Returns a description of the missing identity field, or null for a well-formed element. */
    private static String validate(ParsedCodeElement element) {
        if (element.kind() == null) {
            return "Element without kind skipped";
        }
        String identity = element.identity();
        if (identity == null || identity.isBlank()) {
            return element.kind() + " element without name or fully qualified name skipped";
        }
        if (element.kind() == ElementKind.MEMBER
                && (element.fullyQualifiedName() == null || element.fullyQualifiedName().isBlank())) {
            return "Member element without fully qualified name skipped";
        }
        return null;
    }

    void mergeAssembly(ParsedCodeElement element) {
        String assemblyName = element.identity();
        if (filters.assemblies().shouldExcludeAssembly(assemblyName)) {
            return;
        }
        MetricsNode node = session.getOrCreateAssembly(assemblyName);
        MetricMerger.mergeMetrics(node, element.metrics());
        MetricMerger.mergeSource(node, element.source());
    }

    void mergeNamespace(ParsedCodeElement element) {
        String namespaceName = element.identity();
        String assemblyName = firstNonBlank(element.containingAssemblyName(), element.parentFullyQualifiedName());
        if (assemblyName == null) {
            assemblyName = session.assemblyOfNamespace(namespaceName)
                    .map(MetricsNode::fullyQualifiedName)
                    .orElseGet(session::defaultAssemblyName);
        }
        if (filters.assemblies().shouldExcludeAssembly(assemblyName)) {
            return;
        }
        MetricsNode node = session.getOrCreateNamespace(assemblyName, namespaceName).node();
        MetricMerger.mergeMetrics(node, element.metrics());
        MetricMerger.mergeSource(node, element.source());
    }

    void mergeType(ParsedCodeElement element) {
        String typeFqn = element.identity();
        if (filters.types().shouldExcludeType(typeFqn) || filters.types().shouldExcludeType(element.name())) {
            return;
        }
        MergeSession.TypeEntry existing = session.type(typeFqn).orElse(null);
        String assemblyName = existing != null
                ? existing.assembly().fullyQualifiedName()
                : resolveAssemblyForType(element, typeFqn);
        if (filters.assemblies().shouldExcludeAssembly(assemblyName)) {
            return;
        }
        MergeSession.TypeEntry entry = existing;
        if (entry == null) {
            String namespaceName = resolveNamespaceForType(element.parentFullyQualifiedName(), assemblyName, typeFqn);
            entry = session.getOrCreateType(assemblyName, namespaceName, typeFqn, typeDisplayName(element.name(), typeFqn));
        }
        MetricMerger.mergeMetrics(entry.node(), element.metrics());
        MetricMerger.mergeSource(entry.node(), element.source());
    }

    void mergeMember(ParsedCodeElement element, String sourcePath) {
        String memberFqn = element.fullyQualifiedName();
        String typeFqn = firstNonBlank(element.parentFullyQualifiedName(), SymbolNormalizer.declaringTypeName(memberFqn));
        if (typeFqn == null) {
            session.warn(memberFqn, sourcePath, "Member without declaring type skipped");
            return;
        }
        if (filters.types().shouldExcludeType(typeFqn)) {
            return;
        }

        MergeSession.TypeEntry type = session.type(typeFqn).orElse(null);
        if (type == null) {
            String assemblyName = firstNonBlank(element.containingAssemblyName(), assemblyFromFqn(typeFqn));
            if (filters.assemblies().shouldExcludeAssembly(assemblyName)) {
                return;
            }
            String namespaceName = NamespaceResolver.resolve(typeFqn, session.namespaceNames());
            type = session.getOrCreateType(assemblyName, namespaceName, typeFqn, typeDisplayName(null, typeFqn));
        } else if (filters.assemblies().shouldExcludeAssembly(type.assembly().fullyQualifiedName())) {
            return;
        }

        MetricsNode member = session.getOrCreateMember(type, memberFqn, memberDisplayName(element.name(), memberFqn, typeFqn));
        updateMemberMetadata(member, element);
        MetricMerger.mergeMetrics(member, element.metrics());
        MetricMerger.mergeSource(member, element.source());
    }

    /**
     * Unknown adopts whatever arrives; a generic Method is refined by Property, Field or Event.
     */
    static void updateMemberMetadata(MetricsNode member, ParsedCodeElement element) {
        MemberKind current = member.memberKind();
        MemberKind incoming = element.memberKind();
        if (current == MemberKind.UNKNOWN
                || (current == MemberKind.METHOD && incoming != MemberKind.UNKNOWN && incoming != MemberKind.METHOD)) {
            member.setMemberKind(incoming);
        }
        if (element.hasFindings()) {
            member.markFindings();
        }
    }

    // --- resolution ---

    private String resolveAssemblyForType(ParsedCodeElement element, String typeFqn) {
        if (element.containingAssemblyName() != null && !element.containingAssemblyName().isBlank()) {
            return element.containingAssemblyName();
        }
        String parent = element.parentFullyQualifiedName();
        if (parent != null && !parent.isBlank()) {
            if (session.hasAssembly(parent)) {
                return parent;
            }
            MetricsNode owner = session.assemblyOfNamespace(parent).orElse(null);
            if (owner != null) {
                return owner.fullyQualifiedName();
            }
        }
        return assemblyFromFqn(typeFqn);
    }

    private String assemblyFromFqn(String typeFqn) {
        String namespaceName = NamespaceResolver.resolve(typeFqn, session.namespaceNames());
        return session.assemblyOfNamespace(namespaceName)
                .map(MetricsNode::fullyQualifiedName)
                .orElseGet(session::defaultAssemblyName);
    }

    /**
     * Explicit parent link first, then the longest known namespace prefix, then slicing.
     */
    private String resolveNamespaceForType(String parent, String assemblyName, String typeFqn) {
        if (parent != null && !parent.isBlank() && !parent.equals(assemblyName) && !session.hasAssembly(parent)) {
            return parent;
        }
        return NamespaceResolver.resolve(typeFqn, session.namespaceNames());
    }

    private static String typeDisplayName(String name, String typeFqn) {
        if (name != null && !name.isBlank() && name.indexOf('.') < 0) {
            return name;
        }
        int lastDot = typeFqn.lastIndexOf('.');
        return lastDot >= 0 ? typeFqn.substring(lastDot + 1) : typeFqn;
    }

    private static String memberDisplayName(String name, String memberFqn, String typeFqn) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (memberFqn.startsWith(typeFqn + ".") && memberFqn.length() > typeFqn.length() + 1) {
            return memberFqn.substring(typeFqn.length() + 1);
        }
        return memberFqn;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
