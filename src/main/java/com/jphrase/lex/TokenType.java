package com.jphrase.lex;

public enum TokenType {
    IDENTIFIER,
    NUMBER,
    CHAR_LIST,
    WHITESPACE,
    START_GROUP,
    END_GROUP
}
