package com.jphrase.registry;

/**
 * Answers whether a piece of text is a known phrase, a prefix of one, or neither.
 * The text is a single word or several words joined with {@code _}.
 */
@FunctionalInterface
public interface PhraseLookup {
    PhraseStatus getPhraseStatus(String text);
}
