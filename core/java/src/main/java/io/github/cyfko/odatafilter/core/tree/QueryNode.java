package io.github.cyfko.odatafilter.core.tree;

import io.github.cyfko.odatafilter.core.model.TypeReference;

/**
 * A node of a parsed, fully typed filter expression tree.
 * <p>
 * The set of node kinds is closed. Consumers that need to branch on the kind of node implement
 * {@link QueryNodeVisitor}, which has one method per kind, so adding a kind breaks every consumer at
 * compile time instead of falling through a default branch.
 * </p>
 *
 * <table border="1">
 * <caption>Node kinds</caption>
 * <thead>
 * <tr><th>Node</th><th>Produced by</th><th>Children</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link RangeVariableReferenceNode}</td><td>{@code $it}, implicit path roots</td><td>none</td></tr>
 * <tr><td>{@link PropertyAccessNode}</td><td>{@code Home}, {@code Address/City}</td><td>source</td></tr>
 * <tr><td>{@link FunctionCallNode}</td><td>{@code geo.distance(Home, Office)}</td><td>arguments</td></tr>
 * <tr><td>{@link BinaryOperatorNode}</td><td>{@code eq ne lt le gt ge and or}</td><td>left, right</td></tr>
 * <tr><td>{@link UnaryOperatorNode}</td><td>{@code not}</td><td>operand</td></tr>
 * <tr><td>{@link LiteralNode}</td><td>{@code 0.5}, {@code 'text'}, {@code true}</td><td>none</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface QueryNode
        permits RangeVariableReferenceNode, PropertyAccessNode, FunctionCallNode,
                BinaryOperatorNode, UnaryOperatorNode, LiteralNode {

    /**
     * Resolved type of the value this node produces. Never {@code null}.
     */
    TypeReference typeReference();

    <R> R accept(QueryNodeVisitor<R> visitor);
}
