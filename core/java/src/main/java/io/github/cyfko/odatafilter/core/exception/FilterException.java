package io.github.cyfko.odatafilter.core.exception;

/**
 * Base class of every error raised while parsing a filter expression.
 * <p>
 * Parsing is all-or-nothing: the first error met in left-to-right, depth-first order aborts the parse and
 * is the only error reported. No partial tree is ever returned alongside it.
 * </p>
 *
 * <p><strong>Error Kinds:</strong></p>
 * <ul>
 *   <li>{@link LexException} - unrecognized character or unterminated literal</li>
 *   <li>{@link FilterSyntaxException} - grammar violation</li>
 *   <li>{@link UnknownIdentifierException} - range variable not in scope</li>
 *   <li>{@link UnknownPropertyException} - property not declared on the searched type</li>
 *   <li>{@link UnknownFunctionException} - no overload matching the argument types</li>
 *   <li>{@link TypeMismatchException} - operand types rejected by an operator</li>
 * </ul>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     FilterQueryOption filter = parser.parse(text);
 * } catch (FilterException e) {
 *     return ResponseEntity.badRequest()
 *         .body(Map.of("kind", e.getKind(), "position", e.getOffset(), "message", e.getMessage()));
 * }
 * }</pre>
 *
 * <p><strong>Offsets:</strong> a {@link io.github.cyfko.odatafilter.core.api.SchemaResolver} knows nothing
 * about the filter text, so the exceptions it raises start unanchored ({@code offset == -1}). The parser
 * anchors them at the offending token with {@link #anchorAt(int)} before they reach the caller.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class FilterException extends RuntimeException {

    /** Offset value of an exception that is not tied to a position in the filter text. */
    public static final int UNANCHORED = -1;

    private final ErrorKind kind;
    private final String detail;
    private int offset;

    protected FilterException(ErrorKind kind, String detail, int offset) {
        super(detail);
        this.kind = kind;
        this.detail = detail;
        this.offset = offset < 0 ? UNANCHORED : offset;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return zero-based offset of the offending token, or {@link #UNANCHORED}
     */
    public int getOffset() {
        return offset;
    }

    /**
     * @return the message without the position suffix
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Ties an unanchored exception to a position in the filter text. An already anchored exception keeps
     * its offset.
     *
     * @param position offset of the offending token
     * @return this exception
     */
    public FilterException anchorAt(int position) {
        if (offset == UNANCHORED && position >= 0) {
            offset = position;
        }
        return this;
    }

    @Override
    public String getMessage() {
        return offset == UNANCHORED ? detail : detail + " at position " + offset;
    }
}
