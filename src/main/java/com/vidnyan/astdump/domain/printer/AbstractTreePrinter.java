package com.vidnyan.astdump.domain.printer;

import com.vidnyan.astdump.domain.model.SourcePosition;
import com.vidnyan.astdump.domain.model.SyntaxNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Line formatting and child selection shared by the traversal strategies.
 */
public abstract class AbstractTreePrinter implements TreePrinter {

    static final String TEE = "|-";
    static final String CORNER = "`-";
    static final String TEE_EXTENSION = "| ";
    static final String CORNER_EXTENSION = "  ";

    @Override
    public final int dump(SyntaxNode root, Appendable out) throws DumpException {
        if (root == null) {
            throw DumpException.noTree();
        }
        writeln(out, root.kindLabel());
        return 1 + dumpChildren(root, out);
    }

    /**
     * Render every printable descendant of {@code root}.
     *
     * @return number of lines written
     */
    protected abstract int dumpChildren(SyntaxNode root, Appendable out);

    /**
     * Children that will actually be rendered. Foreign subtrees are dropped
     * here, so the last element is the one that gets the corner connector.
     */
    protected static List<SyntaxNode> printableChildren(SyntaxNode node) {
        return node.children().stream()
                .filter(child -> !child.foreignOrigin())
                .toList();
    }

    protected static String connector(boolean last) {
        return last ? CORNER : TEE;
    }

    protected static String childPrefix(String prefix, boolean last) {
        return prefix + (last ? CORNER_EXTENSION : TEE_EXTENSION);
    }

    /**
     * Format the line of a non-root node, without the trailing newline.
     */
    protected static String formatLine(SyntaxNode node, SourcePosition parentPoint,
                                       String prefix, boolean last) {
        SourcePosition start = node.range().start();
        SourcePosition end = node.range().inclusiveEnd();

        StringBuilder line = new StringBuilder(prefix)
                .append(connector(last))
                .append(node.kindLabel()).append(' ')
                .append(node.id()).append(' ')
                .append(RelativeLocations.printRange(parentPoint, start, end)).append(' ')
                .append(RelativeLocations.printRelative(end, node.pointLocation())).append(' ');
        if (node.isUsage()) {
            line.append(node.definitionId()).append(' ');
        }
        line.append(node.spelling()).append(' ')
                .append(node.typeText());
        return line.toString();
    }

    protected static void writeln(Appendable out, String content) {
        try {
            out.append(content).append('\n');
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write dump output", e);
        }
    }
}
