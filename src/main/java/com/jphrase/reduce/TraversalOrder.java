package com.jphrase.reduce;

import com.jphrase.parse.MalformedTreeException;
import com.jphrase.parse.SyntaxNode;
import com.jphrase.parse.SyntaxTree;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.stack.primitive.MutableIntStack;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.factory.primitive.IntStacks;

/**
 * Order in which phrase reduction visits the interior nodes of a tree.
 */
public final class TraversalOrder {

    private TraversalOrder() {
    }

    /**
     * Lists every node with at least one child so that each appears after all of its interior
     * descendants, and everything under a node's left child appears before everything under its
     * right child. Walks with two explicit stacks, so depth is not limited by the call stack.
     *
     * @throws MalformedTreeException if a child index is missing from the tree or a node is its own ancestor
     */
    public static IntList parentsOf(SyntaxTree tree) {
        MutableIntStack process = IntStacks.mutable.with(tree.getRoot());
        MutableIntStack parents = IntStacks.mutable.empty();

        while (process.notEmpty()) {
            int index = process.pop();
            SyntaxNode node = tree.requireNode(index);
            if (!node.hasChildren()) {
                continue;
            }

            // right is popped first, so the replay below sees left before right
            if (node.getLeft() != null) {
                process.push(node.getLeft());
            }
            if (node.getRight() != null) {
                process.push(node.getRight());
            }
            parents.push(index);
            if (parents.size() > tree.size()) {
                throw new MalformedTreeException("Cycle through node at index " + index, index);
            }
        }

        MutableIntList order = IntLists.mutable.empty();
        while (parents.notEmpty()) {
            order.add(parents.pop());
        }
        return order;
    }
}
