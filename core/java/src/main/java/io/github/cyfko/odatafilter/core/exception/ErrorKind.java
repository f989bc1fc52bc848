package io.github.cyfko.odatafilter.core.exception;

/**
 * Category of a {@link FilterException}, suitable for mapping to client-facing error codes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ErrorKind {
    LEX_ERROR,
    SYNTAX_ERROR,
    UNKNOWN_IDENTIFIER,
    UNKNOWN_PROPERTY,
    UNKNOWN_FUNCTION,
    TYPE_MISMATCH
}
