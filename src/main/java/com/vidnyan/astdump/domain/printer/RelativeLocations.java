package com.vidnyan.astdump.domain.printer;

import com.vidnyan.astdump.domain.model.SourcePosition;

/**
 * Renders positions relative to a base position, the way compiler AST dumps do:
 * only the column when the line is unchanged, the full position otherwise.
 */
public final class RelativeLocations {

    private RelativeLocations() {
    }

    public static String printRelative(SourcePosition base, SourcePosition target) {
        if (target.line() == base.line()) {
            return "col:" + target.column();
        }
        return "line:" + target.line() + ":" + target.column();
    }

    /**
     * Range rendering between angle brackets. The end component is omitted
     * when it coincides with the start.
     *
     * @param parentPoint   point location of the enclosing node
     * @param start         range start
     * @param inclusiveEnd  range end, already converted to an inclusive column
     */
    public static String printRange(SourcePosition parentPoint, SourcePosition start,
                                    SourcePosition inclusiveEnd) {
        StringBuilder sb = new StringBuilder("<");
        sb.append(printRelative(parentPoint, start));
        if (!start.equals(inclusiveEnd)) {
            sb.append(", ").append(printRelative(start, inclusiveEnd));
        }
        return sb.append('>').toString();
    }
}
