package io.github.cyfko.odatafilter.core.tree;

/**
 * Double-dispatch entry point over the closed set of {@link QueryNode} kinds.
 *
 * @param <R> result type of the traversal
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryNodeVisitor<R> {

    R visit(RangeVariableReferenceNode node);

    R visit(PropertyAccessNode node);

    R visit(FunctionCallNode node);

    R visit(BinaryOperatorNode node);

    R visit(UnaryOperatorNode node);

    R visit(LiteralNode node);
}
