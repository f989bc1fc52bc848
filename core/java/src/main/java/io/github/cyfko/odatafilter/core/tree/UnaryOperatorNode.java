package io.github.cyfko.odatafilter.core.tree;

import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.Objects;

/**
 * Unary operator applied to a single operand.
 *
 * @param operatorKind  the operator
 * @param operand       the operand
 * @param typeReference result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record UnaryOperatorNode(UnaryOperatorKind operatorKind, QueryNode operand, TypeReference typeReference) implements QueryNode {

    public UnaryOperatorNode {
        Objects.requireNonNull(operatorKind, "operatorKind");
        Objects.requireNonNull(operand, "operand");
        Objects.requireNonNull(typeReference, "typeReference");
    }

    @Override
    public <R> R accept(QueryNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
