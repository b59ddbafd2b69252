package com.metricsfusion.core.merge;

/**
 * Non-fatal problem found while merging, such as an element without identity fields.
 */
public record AggregationWarning(String fullyQualifiedName, String sourcePath, String message) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(message);
        if (fullyQualifiedName != null) {
            sb.append(" [symbol=").append(fullyQualifiedName).append(']');
        }
        if (sourcePath != null) {
            sb.append(" [source=").append(sourcePath).append(']');
        }
        return sb.toString();
    }
}
