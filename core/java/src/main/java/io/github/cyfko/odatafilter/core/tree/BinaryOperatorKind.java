package io.github.cyfko.odatafilter.core.tree;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binary operators of the filter language, with their keyword and their display name in diagnostic dumps.
 *
 * <table border="1">
 * <caption>Operators</caption>
 * <thead>
 * <tr><th>Keyword</th><th>Kind</th><th>Category</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>or</td><td>{@link #OR}</td><td>logical</td></tr>
 * <tr><td>and</td><td>{@link #AND}</td><td>logical</td></tr>
 * <tr><td>eq, ne</td><td>{@link #EQUAL}, {@link #NOT_EQUAL}</td><td>equality</td></tr>
 * <tr><td>gt, ge, lt, le</td><td>{@link #GREATER_THAN}, {@link #GREATER_THAN_OR_EQUAL},
 *     {@link #LESS_THAN}, {@link #LESS_THAN_OR_EQUAL}</td><td>ordering</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BinaryOperatorKind {
    OR("or", "Or"),
    AND("and", "And"),
    EQUAL("eq", "Equal"),
    NOT_EQUAL("ne", "NotEqual"),
    GREATER_THAN("gt", "GreaterThan"),
    GREATER_THAN_OR_EQUAL("ge", "GreaterThanOrEqual"),
    LESS_THAN("lt", "LessThan"),
    LESS_THAN_OR_EQUAL("le", "LessThanOrEqual");

    private static final Map<String, BinaryOperatorKind> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BinaryOperatorKind::keyword, Function.identity()));

    private final String keyword;
    private final String displayName;

    BinaryOperatorKind(String keyword, String displayName) {
        this.keyword = keyword;
        this.displayName = displayName;
    }

    public String keyword() {
        return keyword;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isLogical() {
        return this == OR || this == AND;
    }

    public boolean isComparison() {
        return !isLogical();
    }

    public boolean isEquality() {
        return this == EQUAL || this == NOT_EQUAL;
    }

    /**
     * Looks up an operator by its (case-sensitive) keyword.
     *
     * @param keyword keyword such as {@code lt}
     * @return the operator, or empty if the keyword is not a binary operator
     */
    public static Optional<BinaryOperatorKind> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }
}
