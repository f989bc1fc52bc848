package io.github.cyfko.odatafilter.core.model;

/**
 * Lexical categories produced by {@link io.github.cyfko.odatafilter.core.parsing.FilterLexer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {
    /** Property names, function names, {@code $}-prefixed range variables and {@code true}/{@code false}. */
    IDENTIFIER,
    /** Signed or unsigned integer and decimal literals, with an optional exponent. */
    NUMBER_LITERAL,
    /** Single-quoted string literals; the raw text keeps the quotes. */
    STRING_LITERAL,
    /** Comparison and logical keywords: {@code lt le gt ge eq ne and or not}. */
    OPERATOR,
    /** {@code ( ) , /} */
    PUNCTUATION,
    /** Terminal token emitted exactly once, at the end of the input. */
    EOF
}
