package com.metricsfusion.core.merge;

/** Raised when cancellation is observed between two documents. */
public class AggregationCancelledException extends AggregationException {

    public AggregationCancelledException(String nextDocument) {
        super("Aggregation cancelled before merging '" + nextDocument + "'", null, nextDocument);
    }
}
