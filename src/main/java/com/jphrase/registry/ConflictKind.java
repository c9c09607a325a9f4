package com.jphrase.registry;

public enum ConflictKind {
    /** The phrase being added is already registered as a prefix of a longer phrase. */
    INCOMPLETE_VERSION_EXISTS,
    /** A prefix of the phrase being added is already registered as a full phrase. */
    COMPLETE_VERSION_EXISTS
}
