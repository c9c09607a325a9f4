package com.jphrase.registry;

public class PhraseConflictException extends IllegalArgumentException {
    private final ConflictKind kind;
    private final String phrase;
    private final String conflictingKey;

    public PhraseConflictException(ConflictKind kind, String phrase, String conflictingKey) {
        super(describe(kind, phrase, conflictingKey));
        this.kind = kind;
        this.phrase = phrase;
        this.conflictingKey = conflictingKey;
    }

    private static String describe(ConflictKind kind, String phrase, String conflictingKey) {
        return switch (kind) {
            case INCOMPLETE_VERSION_EXISTS ->
                    "Cannot add phrase '" + phrase + "': '" + conflictingKey + "' is already a prefix of another phrase";
            case COMPLETE_VERSION_EXISTS ->
                    "Cannot add phrase '" + phrase + "': prefix '" + conflictingKey + "' is already a complete phrase";
        };
    }

    public ConflictKind getKind() {
        return kind;
    }

    public String getPhrase() {
        return phrase;
    }

    public String getConflictingKey() {
        return conflictingKey;
    }
}
