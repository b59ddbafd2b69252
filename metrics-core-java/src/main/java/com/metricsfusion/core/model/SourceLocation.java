package com.metricsfusion.core.model;

/**
 * File reference of a symbol. Line numbers are 1-based and optional.
 */
public record SourceLocation(String path, Integer startLine, Integer endLine) {

    public static SourceLocation of(String path, int startLine, int endLine) {
        return new SourceLocation(path, startLine, endLine);
    }

    public boolean hasStartLine() { return startLine != null; }

    public boolean hasEndLine() { return endLine != null; }
}
