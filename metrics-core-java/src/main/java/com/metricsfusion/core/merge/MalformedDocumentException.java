package com.metricsfusion.core.merge;

public class MalformedDocumentException extends AggregationException {

    public MalformedDocumentException(String message, String sourcePath) {
        super(message, null, sourcePath);
    }
}
