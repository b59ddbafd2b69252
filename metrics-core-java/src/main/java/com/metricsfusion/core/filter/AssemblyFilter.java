package com.metricsfusion.core.filter;

/**
 * Excludes assemblies whose name contains a configured pattern (case-insensitive).
 */
public class AssemblyFilter {

    private final NamePatternSet patterns;

    public AssemblyFilter(NamePatternSet patterns) {
        this.patterns = patterns != null ? patterns : NamePatternSet.empty();
    }

    public static AssemblyFilter none() {
        return new AssemblyFilter(NamePatternSet.empty());
    }

    public static AssemblyFilter fromPatterns(String raw) {
        return new AssemblyFilter(NamePatternSet.parse(raw, false));
    }

    public NamePatternSet patterns() { return patterns; }

    public boolean shouldExcludeAssembly(String assemblyName) {
        return patterns.matchesContaining(assemblyName);
    }
}
