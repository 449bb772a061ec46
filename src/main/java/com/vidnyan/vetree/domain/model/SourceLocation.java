package com.vidnyan.vetree.domain.model;

/**
 * Position inside a source file.
 * Lines and columns are 1-based; the end column is exclusive.
 */
public record SourceLocation(
    String filePath,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    /**
     * Create a zero-width location.
     */
    public static SourceLocation at(String filePath, int line, int column) {
        return new SourceLocation(filePath, line, column, line, column);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
