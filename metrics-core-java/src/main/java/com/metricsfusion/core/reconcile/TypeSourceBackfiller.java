package com.metricsfusion.core.reconcile;

import com.metricsfusion.core.merge.MergeSession;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills in missing or partial type source locations from the type's members.
 *
 * Members are grouped by file; the file holding the most members wins (ties go to the file
 * whose first member starts earliest). The type then spans that group's lines. Whatever the
 * type already knew (path, start or end line) is kept. A type that already names its file only
 * takes lines from members in that file.
 */
public final class TypeSourceBackfiller {

    private TypeSourceBackfiller() {}

    /** Returns the number of types whose source location changed. */
    public static int populateMissingSources(MergeSession session) {
        int updated = 0;
        for (MergeSession.TypeEntry entry : session.types()) {
            MetricsNode type = entry.node();
            SourceLocation existing = type.source();
            boolean hasPath = existing != null && existing.path() != null && !existing.path().isBlank();
            if (hasPath && existing.hasStartLine()) continue;

            List<SourceLocation> group = preferredGroup(type.children(), hasPath ? existing.path() : null);
            if (group.isEmpty()) continue;

            int candidateStart = Integer.MAX_VALUE;
            int candidateEnd = Integer.MIN_VALUE;
            for (SourceLocation location : group) {
                candidateStart = Math.min(candidateStart, location.startLine());
                int end = location.hasEndLine() ? location.endLine() : location.startLine();
                candidateEnd = Math.max(candidateEnd, end);
            }

            String path = hasPath ? existing.path() : group.get(0).path();
            Integer start = existing != null && existing.hasStartLine() ? existing.startLine() : candidateStart;
            Integer end = existing != null && existing.hasEndLine() ? existing.endLine() : candidateEnd;
            type.setSource(new SourceLocation(path, start, end));
            updated++;
        }
        return updated;
    }

    /** @param knownPath file the type is already known to live in, or null */
    private static List<SourceLocation> preferredGroup(List<MetricsNode> members, String knownPath) {
        Map<String, List<SourceLocation>> byPath = new LinkedHashMap<>();
        for (MetricsNode member : members) {
            SourceLocation source = member.source();
            if (source == null || source.path() == null || !source.hasStartLine()) continue;
            byPath.computeIfAbsent(normalizePath(source.path()), k -> new ArrayList<>()).add(source);
        }
        if (knownPath != null) {
            return byPath.getOrDefault(normalizePath(knownPath), List.of());
        }
        List<SourceLocation> best = List.of();
        int bestStart = Integer.MAX_VALUE;
        for (List<SourceLocation> group : byPath.values()) {
            int groupStart = group.stream().mapToInt(SourceLocation::startLine).min().orElse(Integer.MAX_VALUE);
            if (group.size() > best.size() || (group.size() == best.size() && groupStart < bestStart)) {
                best = group;
                bestStart = groupStart;
            }
        }
        return best;
    }

    private static String normalizePath(String path) {
        return path.replace('\\', '/');
    }
}
