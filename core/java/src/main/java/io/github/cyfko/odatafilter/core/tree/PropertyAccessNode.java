package io.github.cyfko.odatafilter.core.tree;

import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.Objects;

/**
 * Access to a single-valued property of the value produced by {@code source}.
 *
 * @param source        node producing the structured value the property is read from
 * @param propertyName  name of the property
 * @param typeReference declared type of the property
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PropertyAccessNode(QueryNode source, String propertyName, TypeReference typeReference) implements QueryNode {

    public PropertyAccessNode {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(propertyName, "propertyName");
        Objects.requireNonNull(typeReference, "typeReference");
    }

    @Override
    public <R> R accept(QueryNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
