package com.vidnyan.astdump.domain.model;

/**
 * Source extent of a node. {@code end} is exclusive: it points one column
 * past the last character of the node.
 */
public record SourceRange(SourcePosition start, SourcePosition end) {

    public SourceRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Range bounds must not be null");
        }
        if (start.compareTo(end) > 0) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    public static SourceRange of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceRange(
                SourcePosition.of(startLine, startColumn),
                SourcePosition.of(endLine, endColumn));
    }

    /**
     * Empty range at the origin, for nodes that have no extent of their own.
     */
    public static SourceRange empty() {
        return new SourceRange(SourcePosition.ORIGIN, SourcePosition.ORIGIN);
    }

    /**
     * The end as an inclusive position, i.e. the column of the last character.
     */
    public SourcePosition inclusiveEnd() {
        return end.shiftColumn(-1);
    }
}
