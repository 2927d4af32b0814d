package com.vidnyan.astdump.domain.printer;

import com.vidnyan.astdump.domain.model.SourcePosition;
import com.vidnyan.astdump.domain.model.SyntaxNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Same output as {@link RecursiveTreePrinter}, driven by a heap-allocated
 * stack so that nesting depth is bounded by memory rather than the call stack.
 */
public class WorklistTreePrinter extends AbstractTreePrinter {

    private record Frame(SyntaxNode node, SourcePosition parentPoint, String prefix, boolean last) {}

    @Override
    protected int dumpChildren(SyntaxNode root, Appendable out) {
        Deque<Frame> stack = new ArrayDeque<>();
        pushChildren(stack, root, "");

        int lines = 0;
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            writeln(out, formatLine(frame.node(), frame.parentPoint(), frame.prefix(), frame.last()));
            lines++;
            pushChildren(stack, frame.node(), childPrefix(frame.prefix(), frame.last()));
        }
        return lines;
    }

    // Reverse order so the first child is popped first.
    private static void pushChildren(Deque<Frame> stack, SyntaxNode parent, String prefix) {
        List<SyntaxNode> children = printableChildren(parent);
        for (int i = children.size() - 1; i >= 0; i--) {
            boolean last = i == children.size() - 1;
            stack.push(new Frame(children.get(i), parent.pointLocation(), prefix, last));
        }
    }
}
