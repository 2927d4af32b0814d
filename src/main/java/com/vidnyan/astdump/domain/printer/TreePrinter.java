package com.vidnyan.astdump.domain.printer;

import com.vidnyan.astdump.domain.model.SyntaxNode;

/**
 * Renders a syntax tree as an indented text diagram, one line per node.
 * Implementations must produce byte-identical output for the same tree.
 */
public interface TreePrinter {

    /**
     * Write the dump of {@code root} to {@code out}.
     *
     * @return number of lines written, root line included
     * @throws DumpException if {@code root} is null; nothing is written then
     * @throws java.io.UncheckedIOException if the sink fails
     */
    int dump(SyntaxNode root, Appendable out) throws DumpException;

    /**
     * Convenience variant returning the dump as a string.
     */
    default String dumpToString(SyntaxNode root) throws DumpException {
        StringBuilder sb = new StringBuilder();
        dump(root, sb);
        return sb.toString();
    }
}
