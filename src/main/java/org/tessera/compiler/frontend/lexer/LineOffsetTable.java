package org.tessera.compiler.frontend.lexer;

import java.util.Arrays;

/**
 * Maps character offsets of a source text to 1-based line and column numbers.
 * The line-start offsets are computed once; lookups binary-search them.
 */
public final class LineOffsetTable {

    private final int[] lineStarts;
    private final int length;

    private LineOffsetTable(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    /**
     * Builds the table for a source text.
     * @param source The source text.
     * @return The offset table.
     */
    public static LineOffsetTable build(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineOffsetTable(Arrays.copyOf(starts, count), source.length());
    }

    /**
     * @param offset A character offset, clamped to the source bounds.
     * @return The 1-based line of the offset.
     */
    public int lineAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int index = Arrays.binarySearch(lineStarts, clamped);
        if (index < 0) {
            index = -index - 2;
        }
        return index + 1;
    }

    /**
     * @param offset A character offset, clamped to the source bounds.
     * @return The 1-based column of the offset.
     */
    public int columnAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        return clamped - lineStarts[lineAt(clamped) - 1] + 1;
    }

    /**
     * @return The number of lines in the source.
     */
    public int lineCount() {
        return lineStarts.length;
    }
}
