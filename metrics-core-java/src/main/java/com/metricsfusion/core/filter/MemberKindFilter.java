package com.metricsfusion.core.filter;

import com.metricsfusion.core.model.MemberKind;

/**
 * Drops whole member kinds from the report. Members carrying static-analysis findings are
 * always kept so no violation disappears from view.
 */
public record MemberKindFilter(boolean excludeMethods, boolean excludeProperties,
                               boolean excludeFields, boolean excludeEvents) {

    public static MemberKindFilter none() {
        return new MemberKindFilter(false, false, false, false);
    }

    public boolean shouldExclude(MemberKind kind, boolean hasFindings) {
        if (hasFindings || kind == null) {
            return false;
        }
        return switch (kind) {
            case METHOD   -> excludeMethods;
            case PROPERTY -> excludeProperties;
            case FIELD    -> excludeFields;
            case EVENT    -> excludeEvents;
            case UNKNOWN  -> false;
        };
    }
}
