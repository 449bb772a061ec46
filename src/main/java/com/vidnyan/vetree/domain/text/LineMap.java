package com.vidnyan.vetree.domain.text;

import com.vidnyan.vetree.domain.model.SourceLocation;

import java.util.Arrays;

/**
 * Line-start table for one buffer of one file.
 * Built once per file parse and discarded with it.
 */
public final class LineMap {

    private final String filePath;
    private final int length;
    private final int[] lineStarts;

    private LineMap(String filePath, int length, int[] lineStarts) {
        this.filePath = filePath;
        this.length = length;
        this.lineStarts = lineStarts;
    }

    public static LineMap of(String filePath, String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineMap(filePath, text.length(), Arrays.copyOf(starts, count));
    }

    /**
     * 1-based line containing the offset.
     */
    public int line(int offset) {
        int clamped = clamp(offset);
        int index = Arrays.binarySearch(lineStarts, clamped);
        if (index < 0) {
            index = -index - 2;
        }
        return index + 1;
    }

    /**
     * 1-based column of the offset within its line.
     */
    public int column(int offset) {
        int clamped = clamp(offset);
        return clamped - lineStarts[line(clamped) - 1] + 1;
    }

    /**
     * Location spanning {@code [start, end)}.
     */
    public SourceLocation location(int start, int end) {
        return new SourceLocation(filePath, line(start), column(start), line(end), column(end));
    }

    public SourceLocation location(int offset) {
        return location(offset, offset);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public String filePath() {
        return filePath;
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, length));
    }
}
