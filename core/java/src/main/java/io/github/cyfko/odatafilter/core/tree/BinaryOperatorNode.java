package io.github.cyfko.odatafilter.core.tree;

import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.Objects;

/**
 * Comparison or logical operator applied to two operands.
 *
 * @param operatorKind  the operator
 * @param left          left operand
 * @param right         right operand
 * @param typeReference result type, always {@code Edm.Boolean}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BinaryOperatorNode(BinaryOperatorKind operatorKind,
                                 QueryNode left,
                                 QueryNode right,
                                 TypeReference typeReference) implements QueryNode {

    public BinaryOperatorNode {
        Objects.requireNonNull(operatorKind, "operatorKind");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(typeReference, "typeReference");
    }

    @Override
    public <R> R accept(QueryNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
