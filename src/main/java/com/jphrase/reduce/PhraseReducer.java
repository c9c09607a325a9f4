package com.jphrase.reduce;

import com.jphrase.parse.Definition;
import com.jphrase.parse.MalformedTreeException;
import com.jphrase.parse.SyntaxNode;
import com.jphrase.parse.SyntaxTree;
import com.jphrase.registry.PhraseLookup;
import com.jphrase.registry.PhraseStatus;
import org.eclipse.collections.api.list.primitive.IntList;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Collapses runs of identifiers that form a known phrase into a single identifier wrapped in an
 * apply node. With {@code perform_task} registered, {@code perform 5 10 task} becomes
 * {@code APPLY_TO(LIST(5, 10), perform_task)}.
 *
 * <p>The input tree is never modified; every call works on its own copy, so one tree can be
 * reduced any number of times against different lookups.
 */
public class PhraseReducer {
    private static final Logger LOG = Logger.getLogger(PhraseReducer.class.getName());

    /**
     * @return a new tree with every recognized phrase rewritten
     * @throws MalformedTreeException if the tree references a node it does not contain
     */
    public SyntaxTree reduce(SyntaxTree tree, PhraseLookup lookup) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(lookup, "lookup must not be null");

        SyntaxTree result = tree.copy();
        if (tree.size() == 0) {
            return result;
        }

        // a single node can't be a parent, it only needs a check of its own
        if (tree.size() == 1) {
            new Reduction(tree, result, lookup, Scopes.of(tree)).check(tree.getRoot(), false);
            return result;
        }

        IntList order = TraversalOrder.parentsOf(tree);
        Reduction reduction = new Reduction(tree, result, lookup, Scopes.of(tree));
        for (int i = 0; i < order.size(); i++) {
            SyntaxNode parent = tree.requireNode(order.get(i));
            reduction.check(parent.getLeft(), true);
            reduction.check(parent.getRight(), false);
        }

        LOG.fine(() -> "Reduced tree of " + tree.size() + " nodes to " + result.size() + " nodes");
        return result;
    }

    /**
     * State of one {@link #reduce} call. Nodes are read from the untouched input and all edits go
     * to the result copy.
     *
     * <p>Phrases do not cross parentheses: a match only continues, and only collects arguments,
     * within the group it started in. A whole group is an ordinary argument outside it.
     */
    private static final class Reduction {
        private final SyntaxTree input;
        private final SyntaxTree result;
        private final PhraseLookup lookup;
        private final Scopes scopes;
        private final Deque<PhraseAccumulator> phrases = new ArrayDeque<>();

        Reduction(SyntaxTree input, SyntaxTree result, PhraseLookup lookup, Scopes scopes) {
            this.input = input;
            this.result = result;
            this.lookup = lookup;
            this.scopes = scopes;
        }

        void check(Integer index, boolean leftOfParent) {
            if (index == null) {
                return;
            }

            SyntaxNode node = input.requireNode(index);
            int scope = scopes.scopeOf(index);
            discardFinishedGroups(scope, scopes.depthOf(index));

            Integer argument = switch (node.getDefinition()) {
                case IDENTIFIER -> checkIdentifier(node, index, scope);
                // a list left of its parent is already part of an operand chain
                case LIST -> leftOfParent ? null : index;
                default -> index;
            };

            PhraseAccumulator open = openIn(scope);
            if (argument != null && open != null) {
                open.addArgument(argument);
            }
        }

        /**
         * Groups are visited as a contiguous block, so reaching a node outside a group means every
         * match started inside it can no longer complete.
         */
        private void discardFinishedGroups(int scope, int depth) {
            PhraseAccumulator top = phrases.peek();
            while (top != null && (top.depth() > depth || (top.depth() == depth && top.scope() != scope))) {
                String abandoned = top.fullText();
                LOG.finer(() -> "Abandoned unfinished phrase '" + abandoned + "' at end of its group");
                phrases.pop();
                top = phrases.peek();
            }
        }

        /**
         * @return the innermost match in progress if it belongs to {@code scope}
         */
        private PhraseAccumulator openIn(int scope) {
            PhraseAccumulator top = phrases.peek();
            return top != null && top.scope() == scope ? top : null;
        }

        private Integer checkIdentifier(SyntaxNode node, int index, int scope) {
            String text = node.getText();
            PhraseAccumulator open = openIn(scope);
            if (open == null) {
                return startOrResolve(index, text);
            }

            String combined = open.fullTextWith(text);
            return switch (statusOf(combined)) {
                case INCOMPLETE -> {
                    open.addPart(text);
                    yield null;
                }
                case COMPLETE -> closePhrase(node, index, scope, combined, open);
                case NOT_A_PHRASE -> {
                    LOG.finer(() -> "'" + combined + "' is not a phrase, checking '" + text + "' on its own");
                    yield startOrResolve(index, text);
                }
            };
        }

        /**
         * Handles an identifier that does not continue an open phrase.
         */
        private Integer startOrResolve(int index, String text) {
            return switch (statusOf(text)) {
                case INCOMPLETE -> {
                    phrases.push(new PhraseAccumulator(text, index, scopes.scopeOf(index), scopes.depthOf(index)));
                    yield null;
                }
                case COMPLETE -> {
                    int apply = spliceEmptyApply(index);
                    LOG.fine(() -> "Resolved single word phrase '" + text + "' at node " + apply);
                    yield apply;
                }
                case NOT_A_PHRASE -> index;
            };
        }

        private Integer closePhrase(SyntaxNode node, int index, int scope, String phrase, PhraseAccumulator open) {
            SyntaxNode identifier = result.requireNode(index);
            identifier.setToken(identifier.getToken().withText(phrase));

            phrases.pop();
            IntList arguments = open.arguments();

            int resolved = switch (arguments.size()) {
                case 0 -> ownsWholeList(node, open) ? becomeEmptyApply(node, index) : spliceEmptyApply(index);
                case 1 -> applyToSingle(node, index, arguments.get(0));
                default -> applyToList(node, index, arguments);
            };

            LOG.fine(() -> "Resolved phrase '" + phrase + "' with " + arguments.size() + " argument(s) at node " + resolved);
            return resolved;
        }

        /**
         * Wraps the identifier in a new {@link Definition#EMPTY_APPLY} node that takes its place
         * under the old parent, or as root.
         */
        private int spliceEmptyApply(int index) {
            SyntaxNode identifier = result.requireNode(index);
            Integer parentIndex = identifier.getParent();

            int apply = result.addNode(new SyntaxNode(
                    Definition.EMPTY_APPLY, parentIndex, index, null, identifier.getToken()));

            if (result.getRoot() == index) {
                result.setRoot(apply);
            }
            if (parentIndex != null) {
                SyntaxNode parent = result.requireNode(parentIndex);
                if (Objects.equals(parent.getLeft(), index)) {
                    parent.setLeft(apply);
                } else if (Objects.equals(parent.getRight(), index)) {
                    parent.setRight(apply);
                }
            }

            identifier.setParent(apply);
            return apply;
        }

        /**
         * The parent can be reused only when its left side holds nothing but the phrase's own
         * words. Anything else there is an operand that must stay in the tree, and an enclosing
         * match still needs the list chain around this one.
         */
        private boolean ownsWholeList(SyntaxNode node, PhraseAccumulator closed) {
            if (openIn(closed.scope()) != null || node.getParent() == null) {
                return false;
            }

            Integer link = input.requireNode(node.getParent()).getLeft();
            for (int words = 2; words < closed.wordCount() && link != null; words++) {
                SyntaxNode list = input.requireNode(link);
                if (list.getDefinition() != Definition.LIST) {
                    return false;
                }
                link = list.getLeft();
            }
            return link != null && link == closed.firstWord();
        }

        private int becomeEmptyApply(SyntaxNode node, int index) {
            int parentIndex = requireParent(node, index);
            SyntaxNode parent = result.requireNode(parentIndex);
            parent.setDefinition(Definition.EMPTY_APPLY);
            parent.setLeft(index);
            parent.setRight(null);
            return parentIndex;
        }

        private int applyToSingle(SyntaxNode node, int index, int argument) {
            int parentIndex = requireParent(node, index);
            SyntaxNode parent = result.requireNode(parentIndex);
            parent.setDefinition(Definition.APPLY_TO);
            parent.setLeft(argument);
            result.requireNode(argument).setParent(parentIndex);
            return parentIndex;
        }

        /**
         * Reuses the list chain left of the parent, one link per argument pair, filling it from the
         * last argument back to the first.
         */
        private int applyToList(SyntaxNode node, int index, IntList arguments) {
            int parentIndex = requireParent(node, index);
            SyntaxNode parent = result.requireNode(parentIndex);
            parent.setDefinition(Definition.APPLY_TO);

            Integer link = parent.getLeft();
            for (int i = arguments.size() - 1; i >= 1; i--) {
                int argument = arguments.get(i);
                SyntaxNode list = result.requireNode(link);
                list.setRight(argument);
                result.requireNode(argument).setParent(link);

                if (i == 1) {
                    int first = arguments.get(0);
                    list.setLeft(first);
                    result.requireNode(first).setParent(link);
                } else {
                    link = list.getLeft();
                }
            }

            return parentIndex;
        }

        private PhraseStatus statusOf(String text) {
            PhraseStatus status = lookup.getPhraseStatus(text);
            return status == null ? PhraseStatus.NOT_A_PHRASE : status;
        }

        private static int requireParent(SyntaxNode node, int index) {
            Integer parent = node.getParent();
            if (parent == null) {
                throw new MalformedTreeException("Phrase ending at node " + index + " has no parent", index);
            }
            return parent;
        }
    }
}
