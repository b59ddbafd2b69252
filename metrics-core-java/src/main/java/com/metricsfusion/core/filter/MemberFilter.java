package com.metricsfusion.core.filter;

import com.metricsfusion.core.normalize.SymbolNormalizer;

/**
 * Decides which members are synthetic noise: names matching the configured patterns and
 * constructors (name equal to the declaring type's simple name, or {@code ctor}/{@code cctor}).
 */
public class MemberFilter {

    private final NamePatternSet patterns;

    public MemberFilter(NamePatternSet patterns) {
        this.patterns = patterns != null ? patterns : NamePatternSet.empty();
    }

    public static MemberFilter none() {
        return new MemberFilter(NamePatternSet.empty());
    }

    public static MemberFilter fromPatterns(String raw, boolean caseSensitive) {
        return new MemberFilter(NamePatternSet.parse(raw, caseSensitive));
    }

    public NamePatternSet patterns() { return patterns; }

    /** True when the bare method name matches an exclusion pattern. */
    public boolean shouldExcludeMethod(String methodName) {
        return patterns.matchesExactly(methodName);
    }

    /** Pattern match on the extracted method name, or constructor detection. */
    public boolean shouldExcludeMember(String memberFqn) {
        if (memberFqn == null || memberFqn.isBlank()) {
            return false;
        }
        String methodName = SymbolNormalizer.extractMethodName(memberFqn);
        return shouldExcludeMethod(methodName) || isConstructor(memberFqn, methodName);
    }

    static boolean isConstructor(String memberFqn, String methodName) {
        if (methodName == null) {
            return false;
        }
        String bare = methodName.startsWith(".") ? methodName.substring(1) : methodName;
        if (bare.equals("ctor") || bare.equals("cctor")) {
            return true;
        }
        String typeName = SymbolNormalizer.declaringTypeName(memberFqn);
        if (typeName == null) {
            return false;
        }
        String simple = SymbolNormalizer.normalizeTypeName(simpleTypeName(typeName));
        return bare.equals(simple);
    }

    private static String simpleTypeName(String typeName) {
        int cut = Math.max(typeName.lastIndexOf('.'), typeName.lastIndexOf('+'));
        return cut >= 0 ? typeName.substring(cut + 1) : typeName;
    }
}
