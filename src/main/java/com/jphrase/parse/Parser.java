package com.jphrase.parse;

import com.jphrase.lex.LexerToken;
import com.jphrase.lex.SourceSyntaxException;
import com.jphrase.lex.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds a {@link SyntaxTree} from lexed tokens. Nodes are appended in token order, so
 * {@code perform 5 task} yields {@code perform, LIST, 5, LIST, task} at indices 0..4 with the
 * second list as root.
 *
 * <p>Whitespace between two values is a {@link Definition#LIST} node whose left side is the
 * expression so far, making space-separated sequences left-associative.
 */
public class Parser {

    /**
     * Parsing state for one level of parentheses.
     */
    private static final class Frame {
        final Integer group;
        final LexerToken opening;
        Integer current;
        Integer pendingList;

        Frame(Integer group, LexerToken opening) {
            this.group = group;
            this.opening = opening;
        }
    }

    public SyntaxTree parse(List<LexerToken> tokens) {
        SyntaxTree tree = new SyntaxTree();
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(null, null));

        for (int i = 0; i < tokens.size(); i++) {
            LexerToken token = tokens.get(i);
            Frame frame = frames.peek();

            switch (token.type()) {
                case WHITESPACE -> {
                    if (frame.current != null && i + 1 < tokens.size() && startsValue(tokens.get(i + 1))) {
                        int list = tree.addNode(new SyntaxNode(Definition.LIST, null, frame.current, null, token));
                        tree.requireNode(frame.current).setParent(list);
                        frame.current = list;
                        frame.pendingList = list;
                    }
                }
                case IDENTIFIER -> attach(tree, frame, tree.addNode(SyntaxNode.leaf(Definition.IDENTIFIER, token)), token);
                case NUMBER -> attach(tree, frame, tree.addNode(SyntaxNode.leaf(Definition.NUMBER, token)), token);
                case CHAR_LIST -> attach(tree, frame, tree.addNode(SyntaxNode.leaf(Definition.CHAR_LIST, token)), token);
                case START_GROUP -> {
                    int close = nextSignificant(tokens, i + 1);
                    if (close < tokens.size() && tokens.get(close).type() == TokenType.END_GROUP) {
                        attach(tree, frame, tree.addNode(SyntaxNode.leaf(Definition.UNIT, token)), token);
                        i = close;
                    } else {
                        int group = tree.addNode(SyntaxNode.leaf(Definition.GROUP, token));
                        attach(tree, frame, group, token);
                        frames.push(new Frame(group, token));
                    }
                }
                case END_GROUP -> {
                    if (frame.group == null) {
                        throw new SourceSyntaxException("Unmatched ')'", token.line(), token.column());
                    }
                    frames.pop();
                    tree.requireNode(frame.group).setLeft(frame.current);
                    tree.requireNode(frame.current).setParent(frame.group);
                }
            }
        }

        Frame last = frames.peek();
        if (last.group != null) {
            throw new SourceSyntaxException("Unclosed '('", last.opening.line(), last.opening.column());
        }
        if (last.current == null) {
            throw new SourceSyntaxException("Empty expression", 0, 0);
        }

        tree.setRoot(last.current);
        return tree;
    }

    private void attach(SyntaxTree tree, Frame frame, int index, LexerToken token) {
        if (frame.pendingList != null) {
            tree.requireNode(frame.pendingList).setRight(index);
            tree.requireNode(index).setParent(frame.pendingList);
            frame.pendingList = null;
        } else if (frame.current == null) {
            frame.current = index;
        } else {
            throw new SourceSyntaxException("Expected whitespace before '" + token.text() + "'", token.line(), token.column());
        }
    }

    private static int nextSignificant(List<LexerToken> tokens, int from) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).type() == TokenType.WHITESPACE) {
            i++;
        }
        return i;
    }

    private static boolean startsValue(LexerToken token) {
        return token.type() != TokenType.WHITESPACE && token.type() != TokenType.END_GROUP;
    }
}
