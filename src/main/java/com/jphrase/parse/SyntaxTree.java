package com.jphrase.parse;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Append-only arena of {@link SyntaxNode}s with a distinguished root. Nodes are never removed,
 * so an index stays valid for the life of the tree.
 */
public final class SyntaxTree {
    private final MutableList<SyntaxNode> nodes;
    private int root;

    public SyntaxTree() {
        this(Lists.mutable.empty(), 0);
    }

    private SyntaxTree(MutableList<SyntaxNode> nodes, int root) {
        this.nodes = nodes;
        this.root = root;
    }

    /**
     * @return the node at {@code index}, or {@code null} if there is none
     */
    public SyntaxNode getNode(Integer index) {
        if (index == null || index < 0 || index >= nodes.size()) {
            return null;
        }
        return nodes.get(index);
    }

    /**
     * @throws MalformedTreeException if there is no node at {@code index}
     */
    public SyntaxNode requireNode(Integer index) {
        SyntaxNode node = getNode(index);
        if (node == null) {
            throw new MalformedTreeException(index);
        }
        return node;
    }

    public int addNode(SyntaxNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    public int getRoot() {
        return root;
    }

    public void setRoot(int root) {
        this.root = root;
    }

    public int size() {
        return nodes.size();
    }

    public ListIterable<SyntaxNode> getNodes() {
        return nodes.asUnmodifiable();
    }

    /**
     * Deep copy. Changes to the copy's nodes never reach this tree.
     */
    public SyntaxTree copy() {
        return new SyntaxTree(nodes.collect(SyntaxNode::copy), root);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxTree other)) {
            return false;
        }
        return root == other.root && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + root;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SyntaxTree(root=").append(root).append(")");
        nodes.forEachWithIndex((node, i) -> sb.append("\n  ").append(i).append(": ").append(node));
        return sb.toString();
    }
}
