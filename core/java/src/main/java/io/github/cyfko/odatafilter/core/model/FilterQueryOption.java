package io.github.cyfko.odatafilter.core.model;

import io.github.cyfko.odatafilter.core.edm.EdmPrimitiveTypes;
import io.github.cyfko.odatafilter.core.tree.QueryNode;

import java.util.Objects;

/**
 * Root artifact of a parsed {@code $filter} query option.
 * <p>
 * Created by a single {@link io.github.cyfko.odatafilter.core.api.FilterParser#parse(String, RangeVariable)}
 * call and immutable afterwards. The expression is always {@code Edm.Boolean}-typed.
 * </p>
 *
 * @param itemType      type of the items being filtered
 * @param rangeVariable variable bound to the current item
 * @param expression    boolean root of the expression tree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterQueryOption(TypeReference itemType, RangeVariable rangeVariable, QueryNode expression) {

    public FilterQueryOption {
        Objects.requireNonNull(itemType, "itemType");
        Objects.requireNonNull(rangeVariable, "rangeVariable");
        Objects.requireNonNull(expression, "expression");
        if (!expression.typeReference().hasName(EdmPrimitiveTypes.BOOLEAN)) {
            throw new IllegalArgumentException("Filter expression must be of type "
                    + EdmPrimitiveTypes.BOOLEAN + ", got: " + expression.typeReference());
        }
    }
}
