package com.metricsfusion.core.merge;

/**
 * Fatal aggregation failure. Carries the offending symbol and input file so the
 * operator can locate the problem without re-running.
 */
public class AggregationException extends RuntimeException {

    private final String fullyQualifiedName;
    private final String sourcePath;

    public AggregationException(String message, String fullyQualifiedName, String sourcePath) {
        super(message);
        this.fullyQualifiedName = fullyQualifiedName;
        this.sourcePath = sourcePath;
    }

    public AggregationException(String message, String fullyQualifiedName, String sourcePath, Throwable cause) {
        super(message, cause);
        this.fullyQualifiedName = fullyQualifiedName;
        this.sourcePath = sourcePath;
    }

    /** Symbol the failure is about, or null when it concerns a whole document. */
    public String getFullyQualifiedName() { return fullyQualifiedName; }

    public String getSourcePath() { return sourcePath; }
}
