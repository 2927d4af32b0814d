package com.vidnyan.astdump.domain.model;

/**
 * A line/column position inside a source file.
 * Real positions are 1-based; {@link #ORIGIN} stands for "no location".
 */
public record SourcePosition(int line, int column) implements Comparable<SourcePosition> {

    public static final SourcePosition ORIGIN = new SourcePosition(0, 0);

    public SourcePosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position: " + line + ":" + column);
        }
    }

    public static SourcePosition of(int line, int column) {
        return new SourcePosition(line, column);
    }

    /**
     * Same line, column shifted by {@code delta}. Never goes below column 0.
     */
    public SourcePosition shiftColumn(int delta) {
        return new SourcePosition(line, Math.max(0, column + delta));
    }

    @Override
    public int compareTo(SourcePosition other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
