package com.metricsfusion.core.filter;

/**
 * Every exclusion rule of one run.
 */
public record SymbolFilters(MemberFilter members, TypeFilter types, AssemblyFilter assemblies,
                            MemberKindFilter memberKinds) {

    public SymbolFilters {
        members = members != null ? members : MemberFilter.none();
        types = types != null ? types : TypeFilter.none();
        assemblies = assemblies != null ? assemblies : AssemblyFilter.none();
        memberKinds = memberKinds != null ? memberKinds : MemberKindFilter.none();
    }

    public static SymbolFilters none() {
        return new SymbolFilters(null, null, null, null);
    }
}
