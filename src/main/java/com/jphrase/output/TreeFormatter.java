package com.jphrase.output;

import com.jphrase.parse.Definition;
import com.jphrase.parse.MalformedTreeException;
import com.jphrase.parse.SyntaxNode;
import com.jphrase.parse.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders a {@link SyntaxTree} from its root, either as an indented outline or as a one-line
 * s-expression such as {@code (APPLY_TO 5 perform_task)}.
 */
public class TreeFormatter {
    private static final String RESET = "\u001B[0m";
    private static final String BLUE = "\u001B[1;34m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";

    private static final String ABSENT = "_";

    private final boolean prettyPrint;
    private final boolean colorOutput;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public TreeFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public TreeFormatter(boolean prettyPrint, boolean colorOutput) {
        this.prettyPrint = prettyPrint;
        this.colorOutput = colorOutput;
    }

    public String format(SyntaxTree tree) {
        if (tree.size() == 0) {
            return "";
        }

        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        if (prettyPrint) {
            formatPretty(tree, tree.getRoot(), sb);
        } else {
            formatCompact(tree, tree.getRoot(), sb);
        }

        return sb.toString();
    }

    private void formatPretty(SyntaxTree tree, int root, StringBuilder sb) {
        Deque<Step> steps = new ArrayDeque<>();
        steps.push(Step.node(root, 0));
        int visited = 0;

        while (!steps.isEmpty()) {
            Step step = steps.pop();
            if (step.indent() > 0) {
                sb.append("\n");
            }
            sb.append(" ".repeat(step.indent()));

            if (step.index() == null) {
                sb.append(ABSENT);
                continue;
            }

            SyntaxNode node = visit(tree, step.index(), ++visited);
            appendDefinition(node.getDefinition(), sb);
            if (!node.hasChildren()) {
                sb.append(" ");
                appendLeaf(node, sb);
                continue;
            }

            if (node.getRight() != null) {
                steps.push(Step.node(node.getRight(), step.indent() + 2));
            }
            steps.push(Step.node(node.getLeft(), step.indent() + 2));
        }
    }

    private void formatCompact(SyntaxTree tree, int root, StringBuilder sb) {
        Deque<Step> steps = new ArrayDeque<>();
        steps.push(Step.node(root, 0));
        int visited = 0;

        while (!steps.isEmpty()) {
            Step step = steps.pop();
            if (step.text() != null) {
                sb.append(step.text());
                continue;
            }
            if (step.index() == null) {
                sb.append(ABSENT);
                continue;
            }

            SyntaxNode node = visit(tree, step.index(), ++visited);
            if (!node.hasChildren()) {
                appendLeaf(node, sb);
                continue;
            }

            sb.append("(");
            appendDefinition(node.getDefinition(), sb);
            sb.append(" ");
            steps.push(Step.text(")"));
            steps.push(Step.node(node.getRight(), 0));
            steps.push(Step.text(" "));
            steps.push(Step.node(node.getLeft(), 0));
        }
    }

    // every node is reached once from the root, so more visits than nodes means a cycle
    private static SyntaxNode visit(SyntaxTree tree, int index, int visited) {
        if (visited > tree.size()) {
            throw new MalformedTreeException("Cycle through node at index " + index, index);
        }
        return tree.requireNode(index);
    }

    private void appendDefinition(Definition definition, StringBuilder sb) {
        if (colorOutput) {
            sb.append(BLUE).append(definition).append(RESET);
        } else {
            sb.append(definition);
        }
    }

    private void appendLeaf(SyntaxNode node, StringBuilder sb) {
        String text = node.getDefinition() == Definition.UNIT ? "()" : node.getText();
        if (colorOutput) {
            String color = node.getDefinition() == Definition.IDENTIFIER ? GREEN : YELLOW;
            sb.append(color).append(text).append(RESET);
        } else {
            sb.append(text);
        }
    }

    /**
     * Pending output: a node to render at an indent, or literal text between siblings.
     */
    private record Step(Integer index, int indent, String text) {
        static Step node(Integer index, int indent) {
            return new Step(index, indent, null);
        }

        static Step text(String text) {
            return new Step(null, 0, text);
        }
    }
}
