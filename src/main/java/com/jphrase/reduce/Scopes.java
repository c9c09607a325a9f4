package com.jphrase.reduce;

import com.jphrase.parse.Definition;
import com.jphrase.parse.MalformedTreeException;
import com.jphrase.parse.SyntaxNode;
import com.jphrase.parse.SyntaxTree;
import org.eclipse.collections.api.stack.primitive.MutableIntStack;
import org.eclipse.collections.impl.factory.primitive.IntStacks;

import java.util.Arrays;

/**
 * For every node reachable from the root, the innermost {@link Definition#GROUP} containing it
 * and how many groups deep it sits. A group node itself belongs to the scope around it.
 */
final class Scopes {
    static final int TOP_LEVEL = -1;

    private final int[] scope;
    private final int[] depth;

    private Scopes(int[] scope, int[] depth) {
        this.scope = scope;
        this.depth = depth;
    }

    static Scopes of(SyntaxTree tree) {
        int[] scope = new int[tree.size()];
        int[] depth = new int[tree.size()];
        Arrays.fill(scope, TOP_LEVEL);

        MutableIntStack pending = IntStacks.mutable.with(tree.getRoot());
        int visited = 0;
        while (pending.notEmpty()) {
            int index = pending.pop();
            SyntaxNode node = tree.requireNode(index);
            if (++visited > tree.size()) {
                throw new MalformedTreeException("Cycle through node at index " + index, index);
            }

            boolean group = node.getDefinition() == Definition.GROUP;
            int childScope = group ? index : scope[index];
            int childDepth = group ? depth[index] + 1 : depth[index];

            for (Integer child : new Integer[]{node.getLeft(), node.getRight()}) {
                if (child != null) {
                    tree.requireNode(child);
                    scope[child] = childScope;
                    depth[child] = childDepth;
                    pending.push(child);
                }
            }
        }

        return new Scopes(scope, depth);
    }

    int scopeOf(int index) {
        return scope[index];
    }

    int depthOf(int index) {
        return depth[index];
    }
}
