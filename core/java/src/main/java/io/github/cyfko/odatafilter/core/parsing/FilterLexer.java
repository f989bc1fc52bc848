package io.github.cyfko.odatafilter.core.parsing;

import io.github.cyfko.odatafilter.core.exception.LexException;
import io.github.cyfko.odatafilter.core.model.Token;
import io.github.cyfko.odatafilter.core.model.TokenKind;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * On-demand scanner turning filter text into {@link Token}s.
 * <p>
 * Tokens are scanned one at a time, only when the consumer asks for them, so a lexical error located after
 * a syntax error is never reported: the parser fails on the syntax error first.
 * </p>
 *
 * <h2>Lexical rules</h2>
 * <ul>
 *   <li>Whitespace between tokens is skipped</li>
 *   <li>Identifiers: a letter, {@code _} or {@code $}, then letters, digits, {@code _} or {@code .}
 *       ({@code Home}, {@code geo.distance}, {@code $it})</li>
 *   <li>Keywords {@code lt le gt ge eq ne and or not} are {@link TokenKind#OPERATOR} tokens (case-sensitive)</li>
 *   <li>Numbers: optional sign, digits, optional fraction, optional exponent ({@code -3}, {@code 0.5}, {@code 1e-3})</li>
 *   <li>Strings: single-quoted, {@code ''} escapes a quote ({@code 'O''Neil'})</li>
 *   <li>Punctuation: {@code ( ) , /}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * for (Token token : FilterLexer.tokenize("geo.distance(Home, Office) lt 0.5")) {
 *     System.out.println(token.kind() + " " + token.text() + " @" + token.offset());
 * }
 * // IDENTIFIER geo.distance @0, PUNCTUATION ( @12, IDENTIFIER Home @13, ... NUMBER_LITERAL 0.5 @30, EOF  @33
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterLexer {

    private static final Set<String> KEYWORDS = Set.of("lt", "le", "gt", "ge", "eq", "ne", "and", "or", "not");

    private final String text;
    private int pos;
    private Token lookahead;

    public FilterLexer(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Returns a lazy view over the tokens of {@code text}, terminated by a single {@link TokenKind#EOF} token.
     * Every call to {@link Iterable#iterator()} rescans the text from the beginning.
     *
     * @param text the filter text
     * @return the token sequence
     * @throws LexException while iterating, when the text contains an invalid character sequence
     */
    public static Iterable<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        return () -> new Iterator<>() {
            private final FilterLexer lexer = new FilterLexer(text);
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public Token next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                Token token = lexer.next();
                done = token.isEof();
                return token;
            }
        };
    }

    /**
     * Returns the next token without consuming it.
     */
    public Token peek() {
        if (lookahead == null) {
            lookahead = scan();
        }
        return lookahead;
    }

    /**
     * Consumes and returns the next token. Once the input is exhausted every call returns the EOF token.
     */
    public Token next() {
        Token token = peek();
        if (!token.isEof()) {
            lookahead = null;
        }
        return token;
    }

    private Token scan() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        if (pos >= text.length()) {
            return Token.eof(text.length());
        }

        int start = pos;
        char c = text.charAt(pos);

        switch (c) {
            case '(', ')', ',', '/' -> {
                pos++;
                return new Token(TokenKind.PUNCTUATION, String.valueOf(c), start);
            }
            case '\'' -> {
                return scanString(start);
            }
            case '-', '+' -> {
                if (pos + 1 < text.length() && isDigit(text.charAt(pos + 1))) {
                    pos++;
                    return scanNumber(start);
                }
                throw new LexException("Sign '" + c + "' must be immediately followed by a digit", start);
            }
            default -> {
                if (isDigit(c)) {
                    return scanNumber(start);
                }
                if (Character.isLetter(c) || c == '_' || c == '$') {
                    return scanIdentifier(start);
                }
                throw new LexException("Unrecognized character '" + c + "'", start);
            }
        }
    }

    private Token scanIdentifier(int start) {
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        String word = text.substring(start, pos);
        if (word.equals("$")) {
            throw new LexException("Range variable marker '$' must be followed by a name", start);
        }
        return new Token(KEYWORDS.contains(word) ? TokenKind.OPERATOR : TokenKind.IDENTIFIER, word, start);
    }

    private Token scanNumber(int start) {
        skipDigits();

        if (pos < text.length() && text.charAt(pos) == '.') {
            if (pos + 1 >= text.length() || !isDigit(text.charAt(pos + 1))) {
                throw new LexException("Malformed numeric literal '" + text.substring(start, pos + 1) + "'", start);
            }
            pos++;
            skipDigits();
        }

        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int exponent = pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= text.length() || !isDigit(text.charAt(pos))) {
                throw new LexException("Exponent of numeric literal has no digits", exponent);
            }
            skipDigits();
        }

        return new Token(TokenKind.NUMBER_LITERAL, text.substring(start, pos), start);
    }

    private Token scanString(int start) {
        pos++;
        while (pos < text.length()) {
            if (text.charAt(pos) == '\'') {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '\'') {
                    pos += 2; // escaped quote
                    continue;
                }
                pos++;
                return new Token(TokenKind.STRING_LITERAL, text.substring(start, pos), start);
            }
            pos++;
        }
        throw new LexException("Unterminated string literal", start);
    }

    private void skipDigits() {
        while (pos < text.length() && isDigit(text.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
