package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.model.FunctionSignature;
import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.cyfko.odatafilter.core.edm.EdmPrimitiveTypes.*;

/**
 * Catalogue of the OData canonical functions usable in filters, in overload declaration order.
 * <p>
 * Return types are nullable: a canonical function returns null when one of its arguments is null.
 * </p>
 *
 * <table border="1">
 * <caption>Canonical functions</caption>
 * <thead>
 * <tr><th>Group</th><th>Functions</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Geo</td><td>geo.distance, geo.length, geo.intersects</td></tr>
 * <tr><td>String</td><td>contains, startswith, endswith, length, indexof, substring, tolower, toupper, trim, concat</td></tr>
 * <tr><td>Math</td><td>round, floor, ceiling</td></tr>
 * <tr><td>Date and time</td><td>year, month, day, hour, minute, second</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BuiltInFunctions {

    private static final List<FunctionSignature> SIGNATURES = declare();

    private BuiltInFunctions() {}

    public static List<FunctionSignature> signatures() {
        return SIGNATURES;
    }

    private static List<FunctionSignature> declare() {
        List<FunctionSignature> all = new ArrayList<>();

        // geo
        all.add(fn("geo.distance", DOUBLE, GEOGRAPHY_POINT, GEOGRAPHY_POINT));
        all.add(fn("geo.distance", DOUBLE, GEOMETRY_POINT, GEOMETRY_POINT));
        all.add(fn("geo.length", DOUBLE, GEOGRAPHY_LINE_STRING));
        all.add(fn("geo.length", DOUBLE, GEOMETRY_LINE_STRING));
        all.add(fn("geo.intersects", BOOLEAN, GEOGRAPHY_POINT, GEOGRAPHY_POLYGON));
        all.add(fn("geo.intersects", BOOLEAN, GEOMETRY_POINT, GEOMETRY_POLYGON));

        // string
        all.add(fn("contains", BOOLEAN, STRING, STRING));
        all.add(fn("startswith", BOOLEAN, STRING, STRING));
        all.add(fn("endswith", BOOLEAN, STRING, STRING));
        all.add(fn("length", INT32, STRING));
        all.add(fn("indexof", INT32, STRING, STRING));
        all.add(fn("substring", STRING, STRING, INT32));
        all.add(fn("substring", STRING, STRING, INT32, INT32));
        all.add(fn("tolower", STRING, STRING));
        all.add(fn("toupper", STRING, STRING));
        all.add(fn("trim", STRING, STRING));
        all.add(fn("concat", STRING, STRING, STRING));

        // math
        for (String name : List.of("round", "floor", "ceiling")) {
            all.add(fn(name, DOUBLE, DOUBLE));
            all.add(fn(name, DECIMAL, DECIMAL));
        }

        // date and time
        for (String name : List.of("year", "month", "day")) {
            all.add(fn(name, INT32, DATE_TIME_OFFSET));
            all.add(fn(name, INT32, DATE));
        }
        for (String name : List.of("hour", "minute", "second")) {
            all.add(fn(name, INT32, DATE_TIME_OFFSET));
            all.add(fn(name, INT32, TIME_OF_DAY));
        }

        return Collections.unmodifiableList(all);
    }

    private static FunctionSignature fn(String name, String returnType, String... parameterTypes) {
        TypeReference[] parameters = new TypeReference[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
            parameters[i] = TypeReference.of(parameterTypes[i]);
        }
        return FunctionSignature.builtIn(name, TypeReference.of(returnType), parameters);
    }
}
