package com.jphrase.lex;

/**
 * Raised by the lexer and parser when source text cannot be turned into a tree.
 */
public class SourceSyntaxException extends IllegalArgumentException {
    private final int line;
    private final int column;

    public SourceSyntaxException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
