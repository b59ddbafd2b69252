package com.metricsfusion.core.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed list of exclusion patterns. Patterns are separated by {@code ,} or {@code ;};
 * a leading {@code .} is ignored so {@code .ctor} and {@code ctor} mean the same thing.
 * Patterns containing {@code *} or {@code ?} are globs and always match the whole name;
 * plain patterns match exactly or by substring depending on the caller.
 */
public final class NamePatternSet {

    private static final NamePatternSet EMPTY = new NamePatternSet(List.of(), List.of(), List.of(), true);

    private final List<String> source;
    private final List<String> plain;
    private final List<Pattern> globs;
    private final boolean caseSensitive;

    private NamePatternSet(List<String> source, List<String> plain, List<Pattern> globs, boolean caseSensitive) {
        this.source = source;
        this.plain = plain;
        this.globs = globs;
        this.caseSensitive = caseSensitive;
    }

    public static NamePatternSet empty() {
        return EMPTY;
    }

    public static NamePatternSet parse(String raw, boolean caseSensitive) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        List<String> source = new ArrayList<>();
        List<String> plain = new ArrayList<>();
        List<Pattern> globs = new ArrayList<>();
        for (String token : raw.split("[,;]")) {
            String pattern = stripLeadingDot(token.trim());
            if (pattern.isEmpty() || source.contains(pattern)) {
                continue;
            }
            source.add(pattern);
            if (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0) {
                globs.add(toRegex(pattern, caseSensitive));
            } else {
                plain.add(caseSensitive ? pattern : pattern.toLowerCase(Locale.ROOT));
            }
        }
        return new NamePatternSet(List.copyOf(source), List.copyOf(plain), List.copyOf(globs), caseSensitive);
    }

    public boolean isEmpty() {
        return source.isEmpty();
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    /** Patterns as configured, after trimming and leading-dot removal. */
    public List<String> patterns() {
        return Collections.unmodifiableList(source);
    }

    /** Plain patterns must equal the name; globs must match all of it. */
    public boolean matchesExactly(String name) {
        if (name == null || isEmpty()) {
            return false;
        }
        String candidate = stripLeadingDot(name);
        String folded = fold(candidate);
        for (String pattern : plain) {
            if (pattern.equals(folded)) {
                return true;
            }
        }
        return matchesGlob(candidate);
    }

    /** Plain patterns may occur anywhere in the name; globs must match all of it. */
    public boolean matchesContaining(String name) {
        if (name == null || isEmpty()) {
            return false;
        }
        String folded = fold(name);
        for (String pattern : plain) {
            if (folded.contains(pattern)) {
                return true;
            }
        }
        return matchesGlob(name);
    }

    private boolean matchesGlob(String name) {
        for (Pattern glob : globs) {
            if (glob.matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    private String fold(String value) {
        return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }

    private static Pattern toRegex(String glob, boolean caseSensitive) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char ch : glob.toCharArray()) {
            if (ch == '*' || ch == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(ch == '*' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return caseSensitive
                ? Pattern.compile(regex.toString())
                : Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String stripLeadingDot(String value) {
        return value.startsWith(".") ? value.substring(1) : value;
    }
}
