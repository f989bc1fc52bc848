package io.github.cyfko.odatafilter.core.model;

import java.util.Objects;

/**
 * A lexical token of a filter expression.
 *
 * @param kind   the lexical category
 * @param text   the raw source text of the token (empty for {@link TokenKind#EOF})
 * @param offset zero-based offset of the first character of the token in the source text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String text, int offset) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
    }

    public static Token eof(int offset) {
        return new Token(TokenKind.EOF, "", offset);
    }

    public boolean is(TokenKind expectedKind, String expectedText) {
        return kind == expectedKind && text.equals(expectedText);
    }

    public boolean isPunctuation(char symbol) {
        return kind == TokenKind.PUNCTUATION && text.length() == 1 && text.charAt(0) == symbol;
    }

    public boolean isEof() {
        return kind == TokenKind.EOF;
    }

    /**
     * Human readable form used in error messages.
     */
    public String describe() {
        return isEof() ? "end of input" : "'" + text + "'";
    }
}
