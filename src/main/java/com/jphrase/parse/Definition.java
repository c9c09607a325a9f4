package com.jphrase.parse;

public enum Definition {
    IDENTIFIER,
    NUMBER,
    CHAR_LIST,
    UNIT,
    GROUP,
    LIST,
    // introduced by phrase reduction
    EMPTY_APPLY,
    APPLY_TO
}
