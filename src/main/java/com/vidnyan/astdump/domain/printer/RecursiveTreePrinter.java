package com.vidnyan.astdump.domain.printer;

import com.vidnyan.astdump.domain.model.SyntaxNode;

import java.util.List;

/**
 * Depth-first recursive rendering. Recursion depth follows the nesting depth
 * of the tree; use {@link WorklistTreePrinter} for pathological inputs.
 */
public class RecursiveTreePrinter extends AbstractTreePrinter {

    @Override
    protected int dumpChildren(SyntaxNode root, Appendable out) {
        return visitChildren(root, "", out);
    }

    private int visitChildren(SyntaxNode parent, String prefix, Appendable out) {
        List<SyntaxNode> children = printableChildren(parent);
        int lines = 0;
        for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            boolean last = i == children.size() - 1;
            writeln(out, formatLine(child, parent.pointLocation(), prefix, last));
            lines += 1 + visitChildren(child, childPrefix(prefix, last), out);
        }
        return lines;
    }
}
