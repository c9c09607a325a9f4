package com.jphrase.reduce;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntLists;

/**
 * A phrase match in progress: the words consumed so far and the argument nodes seen between them.
 */
final class PhraseAccumulator {
    private final MutableList<String> parts = Lists.mutable.empty();
    private final MutableIntList arguments = IntLists.mutable.empty();
    private final int firstWord;
    private final int scope;
    private final int depth;

    /**
     * @param firstWord node index of the word that opened the match
     * @param scope index of the group the first word sits in, {@link Scopes#TOP_LEVEL} outside any group
     * @param depth number of groups enclosing the first word
     */
    PhraseAccumulator(String firstPart, int firstWord, int scope, int depth) {
        parts.add(firstPart);
        this.firstWord = firstWord;
        this.scope = scope;
        this.depth = depth;
    }

    int firstWord() {
        return firstWord;
    }

    int wordCount() {
        return parts.size();
    }

    int scope() {
        return scope;
    }

    int depth() {
        return depth;
    }

    String fullText() {
        return parts.makeString("_");
    }

    String fullTextWith(String part) {
        return fullText() + "_" + part;
    }

    void addPart(String part) {
        parts.add(part);
    }

    void addArgument(int argument) {
        arguments.add(argument);
    }

    IntList arguments() {
        return arguments;
    }
}
