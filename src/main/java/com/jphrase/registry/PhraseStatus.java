package com.jphrase.registry;

public enum PhraseStatus {
    /** A valid prefix that must be continued. */
    INCOMPLETE,
    /** A full phrase. */
    COMPLETE,
    NOT_A_PHRASE
}
