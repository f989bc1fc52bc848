package io.github.cyfko.odatafilter.core.tree;

import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.Objects;

/**
 * Reference to the range variable in scope. The variable itself is shared, not owned.
 *
 * @param rangeVariable the referenced variable
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RangeVariableReferenceNode(RangeVariable rangeVariable) implements QueryNode {

    public RangeVariableReferenceNode {
        Objects.requireNonNull(rangeVariable, "rangeVariable");
    }

    public String name() {
        return rangeVariable.name();
    }

    @Override
    public TypeReference typeReference() {
        return rangeVariable.typeReference();
    }

    @Override
    public <R> R accept(QueryNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
