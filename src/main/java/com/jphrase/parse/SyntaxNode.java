package com.jphrase.parse;

import com.jphrase.lex.LexerToken;

import java.util.Objects;

/**
 * A node in a {@link SyntaxTree}. Parent and child links are indices into the owning tree,
 * {@code null} when absent.
 */
public final class SyntaxNode {
    private Definition definition;
    private Integer parent;
    private Integer left;
    private Integer right;
    private LexerToken token;

    public SyntaxNode(Definition definition, Integer parent, Integer left, Integer right, LexerToken token) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.parent = parent;
        this.left = left;
        this.right = right;
        this.token = Objects.requireNonNull(token, "token must not be null");
    }

    public static SyntaxNode leaf(Definition definition, LexerToken token) {
        return new SyntaxNode(definition, null, null, null, token);
    }

    public Definition getDefinition() {
        return definition;
    }

    public void setDefinition(Definition definition) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
    }

    public Integer getParent() {
        return parent;
    }

    public void setParent(Integer parent) {
        this.parent = parent;
    }

    public Integer getLeft() {
        return left;
    }

    public void setLeft(Integer left) {
        this.left = left;
    }

    public Integer getRight() {
        return right;
    }

    public void setRight(Integer right) {
        this.right = right;
    }

    public boolean hasChildren() {
        return left != null || right != null;
    }

    public LexerToken getToken() {
        return token;
    }

    public void setToken(LexerToken token) {
        this.token = Objects.requireNonNull(token, "token must not be null");
    }

    public String getText() {
        return token.text();
    }

    public SyntaxNode copy() {
        return new SyntaxNode(definition, parent, left, right, token);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxNode other)) {
            return false;
        }
        return definition == other.definition
                && Objects.equals(parent, other.parent)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right)
                && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(definition, parent, left, right, token);
    }

    @Override
    public String toString() {
        return definition + "(\"" + token.text() + "\", parent=" + parent + ", left=" + left + ", right=" + right + ")";
    }
}
