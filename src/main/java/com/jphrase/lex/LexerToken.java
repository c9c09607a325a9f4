package com.jphrase.lex;

import java.util.Objects;

/**
 * A single lexed token. Line and column are 0-based and point at the first character.
 */
public record LexerToken(String text, TokenType type, int line, int column) {
    public LexerToken {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public LexerToken withText(String newText) {
        return new LexerToken(newText, type, line, column);
    }
}
