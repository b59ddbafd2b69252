package com.metricsfusion.core.filter;

/**
 * Excludes types by name. Plain patterns match anywhere in the name, ignoring case.
 */
public class TypeFilter {

    private final NamePatternSet patterns;

    public TypeFilter(NamePatternSet patterns) {
        this.patterns = patterns != null ? patterns : NamePatternSet.empty();
    }

    public static TypeFilter none() {
        return new TypeFilter(NamePatternSet.empty());
    }

    public static TypeFilter fromPatterns(String raw) {
        return new TypeFilter(NamePatternSet.parse(raw, false));
    }

    public NamePatternSet patterns() { return patterns; }

    public boolean shouldExcludeType(String typeName) {
        return patterns.matchesContaining(typeName);
    }
}
