package com.vidnyan.vetree.domain.model;

/**
 * Raw content of one source file.
 */
public record SourceFile(
    String filePath,
    String text
) {}
