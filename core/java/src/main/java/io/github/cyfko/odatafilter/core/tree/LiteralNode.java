package io.github.cyfko.odatafilter.core.tree;

import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.Objects;

/**
 * Constant value written in the filter text.
 *
 * @param literalText   the literal exactly as written, quotes included for strings
 * @param value         the parsed value ({@link Integer}, {@link Long}, {@link java.math.BigDecimal},
 *                      {@link Double}, {@link String} or {@link Boolean})
 * @param typeReference type of the literal, never nullable
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LiteralNode(String literalText, Object value, TypeReference typeReference) implements QueryNode {

    public LiteralNode {
        Objects.requireNonNull(literalText, "literalText");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(typeReference, "typeReference");
    }

    @Override
    public <R> R accept(QueryNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
