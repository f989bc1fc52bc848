package io.github.cyfko.odatafilter.core.exception;

/**
 * Thrown when the filter text contains a character sequence that is not a token: an unrecognized
 * character, a sign without digits, a dangling exponent or an unterminated string literal.
 *
 * <pre>{@code
 * parser.parse("Name eq 'John");   // Unterminated string literal at position 8
 * parser.parse("Age gt 1 # 2");    // Unrecognized character '#' at position 9
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexException extends FilterException {

    public LexException(String message, int offset) {
        super(ErrorKind.LEX_ERROR, message, offset);
    }
}
