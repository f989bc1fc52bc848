package io.github.cyfko.odatafilter.core.exception;

/**
 * Exception thrown when a filter expression is made of valid tokens arranged in an invalid way.
 * <p>
 * It carries the offset of the unexpected token, a description of what the grammar expected at that
 * point and a description of what was found instead, so that interactive editors can highlight the
 * exact location of the problem.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Missing closing parenthesis:</strong> {@code geo.distance(Home, Office lt 0.5}</li>
 *   <li><strong>Chained comparisons:</strong> {@code a lt b lt c}</li>
 *   <li><strong>Missing operand:</strong> {@code Age gt}</li>
 *   <li><strong>Trailing tokens:</strong> {@code Age gt 1 2}</li>
 *   <li><strong>Policy violations:</strong> blank input, input or nesting beyond
 *       {@link io.github.cyfko.odatafilter.core.config.ParserPolicy} limits</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("geo.distance(Home, Office lt 0.5");
 * // → "Unexpected 'lt', expected ',' or ')' at position 26"
 *
 * parser.parse("a lt b lt c");
 * // → "Chained comparison: comparison operators are not associative, found 'lt' at position 7"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterSyntaxException extends FilterException {

    private final String expected;
    private final String found;

    /**
     * @param message  description of the violation
     * @param offset   offset of the offending token
     * @param expected what the grammar accepted at that point, e.g. {@code "',' or ')'"}
     * @param found    description of the offending token, e.g. {@code "'lt'"}
     */
    public FilterSyntaxException(String message, int offset, String expected, String found) {
        super(ErrorKind.SYNTAX_ERROR, message, offset);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
