package com.metricsfusion.core.merge;

/**
 * Two coverage documents define the same type or member.
 */
public class DuplicateSymbolException extends AggregationException {

    private final String firstDocument;
    private final String secondDocument;

    public DuplicateSymbolException(String symbolKind, String fullyQualifiedName,
                                    String firstDocument, String secondDocument) {
        super("Duplicate " + symbolKind + " '" + fullyQualifiedName + "' detected in '" + firstDocument
                        + "' and '" + secondDocument + "'. Ensure coverage inputs do not overlap.",
                fullyQualifiedName, secondDocument);
        this.firstDocument = firstDocument;
        this.secondDocument = secondDocument;
    }

    public String getFirstDocument()  { return firstDocument; }
    public String getSecondDocument() { return secondDocument; }
}
