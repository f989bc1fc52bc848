package io.github.cyfko.odatafilter.core.tree;

import io.github.cyfko.odatafilter.core.model.FunctionSignature;
import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.List;
import java.util.Objects;

/**
 * Call of a single-valued function such as {@code geo.distance(Home, Office)}.
 *
 * @param name             function name as written in the filter
 * @param returnType       resolved return type
 * @param arguments        typed argument nodes, in call order
 * @param matchedSignature overload the call was resolved to
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionCallNode(String name,
                               TypeReference returnType,
                               List<QueryNode> arguments,
                               FunctionSignature matchedSignature) implements QueryNode {

    public FunctionCallNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(matchedSignature, "matchedSignature");
        arguments = List.copyOf(arguments);
    }

    @Override
    public TypeReference typeReference() {
        return returnType;
    }

    @Override
    public <R> R accept(QueryNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
