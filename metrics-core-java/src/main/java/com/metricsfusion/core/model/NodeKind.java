package com.metricsfusion.core.model;

import java.util.Optional;

/**
 * Tag of a {@link MetricsNode}. Each kind owns children of exactly one other kind.
 */
public enum NodeKind {
    SOLUTION("Solution"),
    ASSEMBLY("Assembly"),
    NAMESPACE("Namespace"),
    TYPE("Type"),
    MEMBER("Member");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public SymbolLevel level() {
        return switch (this) {
            case SOLUTION  -> SymbolLevel.SOLUTION;
            case ASSEMBLY  -> SymbolLevel.ASSEMBLY;
            case NAMESPACE -> SymbolLevel.NAMESPACE;
            case TYPE      -> SymbolLevel.TYPE;
            case MEMBER    -> SymbolLevel.MEMBER;
        };
    }

    /** Kind of the children this kind owns; empty for members. */
    public Optional<NodeKind> childKind() {
        return switch (this) {
            case SOLUTION  -> Optional.of(ASSEMBLY);
            case ASSEMBLY  -> Optional.of(NAMESPACE);
            case NAMESPACE -> Optional.of(TYPE);
            case TYPE      -> Optional.of(MEMBER);
            case MEMBER    -> Optional.empty();
        };
    }

    /** Report property holding the children of this kind; null for members. */
    public String childrenProperty() {
        return switch (this) {
            case SOLUTION  -> "assemblies";
            case ASSEMBLY  -> "namespaces";
            case NAMESPACE -> "types";
            case TYPE      -> "members";
            case MEMBER    -> null;
        };
    }

    public static Optional<NodeKind> fromLabel(String label) {
        for (NodeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
