package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.List;
import java.util.Map;

/**
 * Names of the EDM primitive types and the implicit conversions allowed between them.
 *
 * <p><strong>Numeric promotion:</strong></p>
 * <pre>
 * Byte, SByte → Int16 → Int32 → Int64 → Single → Double
 * Byte, SByte, Int16, Int32, Int64 → Decimal
 * </pre>
 * <p>Spatial types convert to their abstract base ({@code Edm.GeographyPoint → Edm.Geography}).
 * No other conversion exists; in particular nothing converts across families.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EdmPrimitiveTypes {

    public static final String BOOLEAN = "Edm.Boolean";
    public static final String BYTE = "Edm.Byte";
    public static final String SBYTE = "Edm.SByte";
    public static final String INT16 = "Edm.Int16";
    public static final String INT32 = "Edm.Int32";
    public static final String INT64 = "Edm.Int64";
    public static final String SINGLE = "Edm.Single";
    public static final String DOUBLE = "Edm.Double";
    public static final String DECIMAL = "Edm.Decimal";
    public static final String STRING = "Edm.String";
    public static final String GUID = "Edm.Guid";
    public static final String DATE = "Edm.Date";
    public static final String DATE_TIME_OFFSET = "Edm.DateTimeOffset";
    public static final String TIME_OF_DAY = "Edm.TimeOfDay";
    public static final String DURATION = "Edm.Duration";
    public static final String BINARY = "Edm.Binary";

    public static final String GEOGRAPHY = "Edm.Geography";
    public static final String GEOGRAPHY_POINT = "Edm.GeographyPoint";
    public static final String GEOGRAPHY_LINE_STRING = "Edm.GeographyLineString";
    public static final String GEOGRAPHY_POLYGON = "Edm.GeographyPolygon";
    public static final String GEOMETRY = "Edm.Geometry";
    public static final String GEOMETRY_POINT = "Edm.GeometryPoint";
    public static final String GEOMETRY_LINE_STRING = "Edm.GeometryLineString";
    public static final String GEOMETRY_POLYGON = "Edm.GeometryPolygon";

    private static final List<String> NUMERIC_LADDER = List.of(INT16, INT32, INT64, SINGLE, DOUBLE);

    private static final Map<String, Integer> NUMERIC_RANK = Map.of(
            BYTE, 0, SBYTE, 0, INT16, 1, INT32, 2, INT64, 3, SINGLE, 4, DOUBLE, 5);

    private EdmPrimitiveTypes() {}

    public static boolean isNumeric(String typeName) {
        return NUMERIC_RANK.containsKey(typeName) || DECIMAL.equals(typeName);
    }

    public static boolean isIntegral(String typeName) {
        Integer rank = NUMERIC_RANK.get(typeName);
        return rank != null && rank <= 3;
    }

    public static boolean isGeography(String typeName) {
        return typeName.startsWith(GEOGRAPHY);
    }

    public static boolean isGeometry(String typeName) {
        return typeName.startsWith(GEOMETRY);
    }

    /**
     * Tells whether a value of type {@code from} may be passed where {@code to} is expected.
     * Nullability and facets are not considered.
     *
     * @param from the actual type
     * @param to   the expected type
     * @return {@code true} if the types are identical or an implicit conversion exists
     */
    public static boolean isAssignable(TypeReference from, TypeReference to) {
        String source = from.name();
        String target = to.name();
        if (source.equals(target)) {
            return true;
        }
        if (DECIMAL.equals(target)) {
            return isIntegral(source);
        }
        Integer sourceRank = NUMERIC_RANK.get(source);
        if (sourceRank != null && NUMERIC_LADDER.contains(target)) {
            return sourceRank < NUMERIC_RANK.get(target);
        }
        if (GEOGRAPHY.equals(target)) {
            return isGeography(source);
        }
        if (GEOMETRY.equals(target)) {
            return isGeometry(source);
        }
        return false;
    }
}
