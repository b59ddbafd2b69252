package com.metricsfusion.core.merge;

import java.util.Set;

/**
 * Namespace inference for types whose parser did not supply a parent namespace.
 */
public final class NamespaceResolver {

    public static final String GLOBAL_NAMESPACE = "<global>";

    private NamespaceResolver() {}

    /**
     * Longest registered namespace that is a dot-prefix of {@code typeFqn}, or null.
     * Must run before {@link #sliceNamespace} so namespaces with dots in their own name
     * are not mistaken for outer types.
     */
    public static String findKnownNamespace(String typeFqn, Set<String> knownNamespaces) {
        if (typeFqn == null || typeFqn.isBlank() || knownNamespaces.isEmpty()) {
            return null;
        }
        int lastDot = typeFqn.lastIndexOf('.');
        while (lastDot > 0) {
            String candidate = typeFqn.substring(0, lastDot);
            if (knownNamespaces.contains(candidate)) {
                return candidate;
            }
            lastDot = candidate.lastIndexOf('.');
        }
        return null;
    }

    /** Everything before the last dot, or {@value #GLOBAL_NAMESPACE} when there is none. */
    public static String sliceNamespace(String typeFqn) {
        if (typeFqn == null || typeFqn.isBlank()) {
            return GLOBAL_NAMESPACE;
        }
        int lastDot = typeFqn.lastIndexOf('.');
        return lastDot <= 0 ? GLOBAL_NAMESPACE : typeFqn.substring(0, lastDot);
    }

    public static String resolve(String typeFqn, Set<String> knownNamespaces) {
        String known = findKnownNamespace(typeFqn, knownNamespaces);
        return known != null ? known : sliceNamespace(typeFqn);
    }
}
