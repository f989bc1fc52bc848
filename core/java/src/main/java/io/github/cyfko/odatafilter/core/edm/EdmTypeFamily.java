package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.model.TypeReference;
import io.github.cyfko.odatafilter.core.tree.BinaryOperatorKind;

/**
 * Comparability families of EDM types.
 * <p>
 * Two operands can be compared only when they belong to the same family and the family supports the
 * operator. Spatial and structured values are never compared directly: they take part in comparisons
 * through function results such as {@code geo.distance}.
 * </p>
 *
 * <table border="1">
 * <caption>Families</caption>
 * <thead>
 * <tr><th>Family</th><th>Types</th><th>eq, ne</th><th>lt, le, gt, ge</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NUMERIC</td><td>Byte, SByte, Int16, Int32, Int64, Single, Double, Decimal</td><td>yes</td><td>yes</td></tr>
 * <tr><td>STRING</td><td>String</td><td>yes</td><td>yes</td></tr>
 * <tr><td>TEMPORAL</td><td>Date, DateTimeOffset, TimeOfDay, Duration</td><td>yes</td><td>yes</td></tr>
 * <tr><td>BOOLEAN</td><td>Boolean</td><td>yes</td><td>no</td></tr>
 * <tr><td>GUID</td><td>Guid</td><td>yes</td><td>no</td></tr>
 * <tr><td>SPATIAL</td><td>Geography*, Geometry*</td><td>no</td><td>no</td></tr>
 * <tr><td>OTHER</td><td>Binary, entity and complex types</td><td>no</td><td>no</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum EdmTypeFamily {
    NUMERIC(true, true),
    STRING(true, true),
    TEMPORAL(true, true),
    BOOLEAN(true, false),
    GUID(true, false),
    SPATIAL(false, false),
    OTHER(false, false);

    private final boolean equality;
    private final boolean ordering;

    EdmTypeFamily(boolean equality, boolean ordering) {
        this.equality = equality;
        this.ordering = ordering;
    }

    public static EdmTypeFamily of(TypeReference type) {
        String name = type.name();
        if (EdmPrimitiveTypes.isNumeric(name)) {
            return NUMERIC;
        }
        if (EdmPrimitiveTypes.isGeography(name) || EdmPrimitiveTypes.isGeometry(name)) {
            return SPATIAL;
        }
        return switch (name) {
            case EdmPrimitiveTypes.STRING -> STRING;
            case EdmPrimitiveTypes.BOOLEAN -> BOOLEAN;
            case EdmPrimitiveTypes.GUID -> GUID;
            case EdmPrimitiveTypes.DATE, EdmPrimitiveTypes.DATE_TIME_OFFSET,
                 EdmPrimitiveTypes.TIME_OF_DAY, EdmPrimitiveTypes.DURATION -> TEMPORAL;
            default -> OTHER;
        };
    }

    public boolean supports(BinaryOperatorKind operator) {
        if (operator.isLogical()) {
            return this == BOOLEAN;
        }
        return operator.isEquality() ? equality : ordering;
    }

    /**
     * Tells whether {@code operator} may compare a value of type {@code left} with a value of type {@code right}.
     */
    public static boolean areComparable(BinaryOperatorKind operator, TypeReference left, TypeReference right) {
        EdmTypeFamily family = of(left);
        return family == of(right) && family.supports(operator);
    }
}
