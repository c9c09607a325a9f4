package com.jphrase.parse;

/**
 * A tree's links do not describe a tree: an index is referenced that the arena does not contain,
 * or a node is reachable from itself.
 */
public class MalformedTreeException extends IllegalStateException {
    private final Integer index;

    public MalformedTreeException(Integer index) {
        this("Node at index " + index + " not present", index);
    }

    public MalformedTreeException(String message, Integer index) {
        super(message);
        this.index = index;
    }

    /**
     * @return the missing index, {@code null} when a required link was absent altogether
     */
    public Integer getIndex() {
        return index;
    }
}
