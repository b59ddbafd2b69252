package com.metricsfusion.core.merge;

import com.metricsfusion.core.filter.SymbolFilters;

/**
 * Runs after all documents are folded: removes members rejected by the member name filter
 * (patterns and constructors) or by the member-kind filter.
 */
public class MemberExclusionPass {

    private final SymbolFilters filters;

    public MemberExclusionPass(SymbolFilters filters) {
        this.filters = filters != null ? filters : SymbolFilters.none();
    }

    /** @return number of members removed */
    public int apply(MergeSession session) {
        int removed = 0;
        for (MergeSession.MemberEntry entry : session.members()) {
            var member = entry.node();
            boolean excluded = filters.members().shouldExcludeMember(member.fullyQualifiedName())
                    || filters.memberKinds().shouldExclude(member.memberKind(), member.hasFindings());
            if (excluded) {
                session.removeMember(entry);
                removed++;
            }
        }
        return removed;
    }
}
