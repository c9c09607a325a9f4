package com.jphrase.lex;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class Lexer {

    public MutableList<LexerToken> lex(String source) {
        MutableList<LexerToken> tokens = Lists.mutable.empty();
        if (source == null) {
            return tokens;
        }

        int i = 0;
        int line = 0;
        int column = 0;

        while (i < source.length()) {
            char c = source.charAt(i);
            int start = i;
            int startLine = line;
            int startColumn = column;

            if (isWhitespace(c)) {
                while (i < source.length() && isWhitespace(source.charAt(i))) {
                    if (source.charAt(i) == '\n') {
                        line++;
                        column = 0;
                    } else {
                        column++;
                    }
                    i++;
                }
                tokens.add(new LexerToken(source.substring(start, i), TokenType.WHITESPACE, startLine, startColumn));
                continue;
            }

            if (isIdentifierStart(c)) {
                while (i < source.length() && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                column += i - start;
                tokens.add(new LexerToken(source.substring(start, i), TokenType.IDENTIFIER, startLine, startColumn));
                continue;
            }

            if (isDigit(c)) {
                i = skipDigits(source, i);
                // only one fraction, and only when a digit follows the dot
                if (i + 1 < source.length() && source.charAt(i) == '.' && isDigit(source.charAt(i + 1))) {
                    i = skipDigits(source, i + 1);
                }
                column += i - start;
                tokens.add(new LexerToken(source.substring(start, i), TokenType.NUMBER, startLine, startColumn));
                continue;
            }

            if (c == '"') {
                i = skipString(source, i, startLine, startColumn);
                column += i - start;
                tokens.add(new LexerToken(source.substring(start, i), TokenType.CHAR_LIST, startLine, startColumn));
                continue;
            }

            if (c == '(' || c == ')') {
                TokenType type = c == '(' ? TokenType.START_GROUP : TokenType.END_GROUP;
                tokens.add(new LexerToken(String.valueOf(c), type, startLine, startColumn));
                i++;
                column++;
                continue;
            }

            throw new SourceSyntaxException("Unexpected character '" + c + "'", startLine, startColumn);
        }

        return tokens;
    }

    private int skipDigits(String source, int i) {
        while (i < source.length() && isDigit(source.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Returns the index just past the closing quote. Strings may not span lines.
     */
    private int skipString(String source, int i, int line, int column) {
        i++; // opening quote
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            if (c == '\n') {
                break;
            }
            i++;
        }
        throw new SourceSyntaxException("Unterminated string", line, column);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
