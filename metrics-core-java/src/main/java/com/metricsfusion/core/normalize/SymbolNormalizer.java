package com.metricsfusion.core.normalize;

/**
 * Maps tool-specific method and type signatures onto the canonical
 * {@code Namespace.Type.Method(...)} form used as merge identity.
 *
 * All functions are total: {@code null} or blank input is returned unchanged.
 * Nested types use {@code +} as separator and are never rewritten here.
 */
public final class SymbolNormalizer {

    public static final String PARAMETER_PLACEHOLDER = "...";

    private SymbolNormalizer() {}

    /**
     * Replaces the parameter list with {@code (...)}.
     * {@code N.T.M(System.Object, List<int>)} becomes {@code N.T.M(...)}.
     * Signatures without a parameter list, or with an unterminated one, are returned as-is.
     */
    public static String normalizeMethodSignature(String signature) {
        if (isBlank(signature)) {
            return signature;
        }
        int open = indexOfTopLevel(signature, '(', 0, signature.length());
        if (open < 0) {
            return signature;
        }
        int close = findClosing(signature, open);
        if (close < 0) {
            return signature;
        }
        return signature.substring(0, open + 1) + PARAMETER_PLACEHOLDER + signature.substring(close);
    }

    /**
     * Bare method name of a signature: {@code void N.T.Run<T>(int a)} gives {@code Run}.
     * Constructors keep their leading dot ({@code N.T..ctor()} gives {@code .ctor}) and
     * compiler tokens such as {@code <Run>b__0_0} are kept verbatim.
     */
    public static String extractMethodName(String signature) {
        if (isBlank(signature)) {
            return signature;
        }
        int end = methodNameEnd(signature);
        int start = lastTopLevelSpace(signature, end) + 1;
        String qualified = stripTrailingGenericList(signature.substring(start, end).trim());

        int lastDot = lastTopLevelDot(qualified, qualified.length());
        String name = lastDot >= 0 ? qualified.substring(lastDot + 1).trim() : qualified;
        if ((name.equals("ctor") || name.equals("cctor")) && lastDot > 0 && qualified.charAt(lastDot - 1) == '.') {
            return "." + name;
        }
        return name;
    }

    /**
     * Canonical FQN of a method: generic arity is removed from the declaring type and from the
     * method itself, and the parameter list is collapsed.
     * {@code N.Repo<T>.Find<TKey>(TKey id)} becomes {@code N.Repo.Find(...)}.
     */
    public static String normalizeFullyQualifiedMethodName(String fullyQualifiedName) {
        if (isBlank(fullyQualifiedName)) {
            return fullyQualifiedName;
        }
        String fqn = fullyQualifiedName;

        int searchEnd = parameterListStart(fqn);
        int lastDot = lastTopLevelDot(fqn, searchEnd);
        if (lastDot > 0) {
            String typePart = fqn.substring(0, lastDot);
            String normalizedType = normalizeTypeName(typePart);
            if (!normalizedType.equals(typePart)) {
                fqn = normalizedType + fqn.substring(lastDot);
                searchEnd = parameterListStart(fqn);
                lastDot = lastTopLevelDot(fqn, searchEnd);
            }
        }

        int genericStart = indexOfTopLevel(fqn, '<', Math.max(lastDot + 1, 0), searchEnd);
        if (genericStart > 0 && isIdentifierChar(fqn.charAt(genericStart - 1))) {
            int genericEnd = findClosing(fqn, genericStart);
            if (genericEnd >= 0 && genericEnd < searchEnd && closesGenericList(fqn, genericEnd, searchEnd)) {
                fqn = fqn.substring(0, genericStart) + fqn.substring(genericEnd + 1);
            }
        }

        return normalizeMethodSignature(fqn);
    }

    /**
     * Removes generic arguments from a type name: {@code System.Collections.Generic.List<String>}
     * becomes {@code System.Collections.Generic.List}. Placeholders such as {@code <global>} and
     * compiler-generated segments such as {@code Outer+<Run>d__3} are left alone.
     */
    public static String normalizeTypeName(String typeName) {
        if (isBlank(typeName)) {
            return typeName;
        }
        if (isPlaceholder(typeName)) {
            return typeName;
        }
        int depth = 0;
        for (int i = 0; i < typeName.length(); i++) {
            char ch = typeName.charAt(i);
            if (ch == '<') {
                if (depth == 0 && i > 0 && isIdentifierChar(typeName.charAt(i - 1))) {
                    return typeName.substring(0, i).trim();
                }
                depth++;
            } else if (ch == '>' && depth > 0) {
                depth--;
            }
        }
        return typeName;
    }

    /**
     * Declaring type of a member FQN: the text before the last top-level dot that precedes the
     * parameter list. {@code N.T..ctor(...)} gives {@code N.T}. Returns null when the FQN has no
     * type part.
     */
    public static String declaringTypeName(String memberFqn) {
        if (isBlank(memberFqn)) {
            return null;
        }
        int lastDot = lastTopLevelDot(memberFqn, parameterListStart(memberFqn));
        if (lastDot > 0 && memberFqn.charAt(lastDot - 1) == '.') {
            lastDot--;
        }
        return lastDot > 0 ? memberFqn.substring(0, lastDot) : null;
    }

    /** {@code <global>}, {@code <unknown-type>} and friends. */
    public static boolean isPlaceholder(String name) {
        return name != null && name.length() > 1 && name.startsWith("<") && name.endsWith(">")
                && findClosing(name, 0) == name.length() - 1;
    }

    // --- scanning helpers ---

    private static int parameterListStart(String text) {
        int open = indexOfTopLevel(text, '(', 0, text.length());
        return open >= 0 ? open : text.length();
    }

    /** End of the method-name part: the first top-level '(' or " where " clause. */
    private static int methodNameEnd(String signature) {
        int end = parameterListStart(signature);
        int where = signature.indexOf(" where ");
        if (where >= 0 && where < end) {
            end = where;
        }
        return end;
    }

    /** Index of {@code target} in [from, to) outside any () or <> nesting; -1 if absent. */
    private static int indexOfTopLevel(String text, char target, int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            char ch = text.charAt(i);
            if (ch == target && depth == 0) {
                return i;
            }
            if (ch == '(' || ch == '<') {
                depth++;
            } else if ((ch == ')' || ch == '>') && depth > 0) {
                depth--;
            }
        }
        return -1;
    }

    private static int lastTopLevelSpace(String text, int end) {
        return lastTopLevel(text, ' ', end);
    }

    private static int lastTopLevelDot(String text, int end) {
        return lastTopLevel(text, '.', end);
    }

    private static int lastTopLevel(String text, char target, int end) {
        int depth = 0;
        int found = -1;
        for (int i = 0; i < end; i++) {
            char ch = text.charAt(i);
            if (ch == '(' || ch == '<') {
                depth++;
            } else if ((ch == ')' || ch == '>') && depth > 0) {
                depth--;
            } else if (ch == target && depth == 0) {
                found = i;
            }
        }
        return found;
    }

    /**
     * Index of the bracket closing the one at {@code open}. Depth counts both parentheses and
     * angle brackets so generic arguments inside a parameter list don't end the scan.
     */
    private static int findClosing(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(' || ch == '<') {
                depth++;
            } else if (ch == ')' || ch == '>') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** A '>' ends a generic list when followed by '(', ' ', ')' or the end of the name part. */
    private static boolean closesGenericList(String text, int genericEnd, int nameEnd) {
        int after = genericEnd + 1;
        if (after >= nameEnd) {
            return true;
        }
        char ch = text.charAt(after);
        return ch == '(' || ch == ' ' || ch == ')';
    }

    private static String stripTrailingGenericList(String name) {
        if (!name.endsWith(">")) {
            return name;
        }
        int genericStart = indexOfTopLevel(name, '<', 0, name.length());
        while (genericStart >= 0) {
            int genericEnd = findClosing(name, genericStart);
            if (genericEnd == name.length() - 1) {
                if (genericStart > 0 && isIdentifierChar(name.charAt(genericStart - 1))) {
                    return name.substring(0, genericStart);
                }
                return name;
            }
            if (genericEnd < 0) {
                return name;
            }
            genericStart = indexOfTopLevel(name, '<', genericEnd + 1, name.length());
        }
        return name;
    }

    private static boolean isIdentifierChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$' || ch == '`';
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
