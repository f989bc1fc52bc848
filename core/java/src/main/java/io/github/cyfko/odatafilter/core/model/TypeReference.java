package io.github.cyfko.odatafilter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Reference to an EDM type as carried by every node of a parsed filter tree.
 * <p>
 * A type reference is a value: two references are equal when their name, nullability and facets
 * are equal. Facets keep their declaration order for rendering, but equality ignores that order.
 * </p>
 *
 * <p><strong>Rendering:</strong></p>
 * <pre>{@code
 * TypeReference.of("Edm.Double", true)                  // [Edm.Double Nullable=True]
 * TypeReference.geography("Edm.GeographyPoint", 4326)   // [Edm.GeographyPoint Nullable=True SRID=4326]
 * TypeReference.of("Test.Person", false)                // [Test.Person Nullable=False]
 * }</pre>
 *
 * @param name     qualified type name ({@code Edm.Int32}, {@code Test.Person})
 * @param nullable whether the value may be null
 * @param facets   additional facets such as {@code SRID}, in declaration order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TypeReference(String name, boolean nullable, Map<String, String> facets) {

    /** Facet name of the spatial reference system identifier. */
    public static final String SRID = "SRID";

    /** {@code SRID} value of a spatial type whose instances may use different reference systems. */
    public static final String SRID_VARIABLE = "variable";

    private static final String EDM_NAMESPACE_PREFIX = "Edm.";

    public TypeReference {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name is required");
        }
        facets = facets == null || facets.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(facets));
        String srid = facets.get(SRID);
        if (srid != null && !srid.equals(SRID_VARIABLE) && !srid.matches("\\d{1,9}")) {
            throw new IllegalArgumentException("SRID must be a non-negative integer or '" + SRID_VARIABLE
                    + "', got '" + srid + "'");
        }
    }

    public static TypeReference of(String name) {
        return new TypeReference(name, true, Map.of());
    }

    public static TypeReference of(String name, boolean nullable) {
        return new TypeReference(name, nullable, Map.of());
    }

    public static TypeReference geography(String name, int srid) {
        return of(name).withFacet(SRID, Integer.toString(srid));
    }

    public TypeReference withFacet(String facet, String value) {
        Objects.requireNonNull(facet, "facet");
        Objects.requireNonNull(value, "value");
        Map<String, String> copy = new LinkedHashMap<>(facets);
        copy.put(facet, value);
        return new TypeReference(name, nullable, copy);
    }

    public TypeReference asNullable(boolean isNullable) {
        return isNullable == nullable ? this : new TypeReference(name, isNullable, facets);
    }

    public boolean isPrimitive() {
        return name.startsWith(EDM_NAMESPACE_PREFIX);
    }

    public boolean hasName(String typeName) {
        return name.equals(typeName);
    }

    /**
     * Returns the numeric spatial reference system, empty when the type has none or a variable one.
     */
    public OptionalInt srid() {
        String value = facets.get(SRID);
        return value == null || value.equals(SRID_VARIABLE)
                ? OptionalInt.empty()
                : OptionalInt.of(Integer.parseInt(value));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[")
                .append(name)
                .append(" Nullable=")
                .append(nullable ? "True" : "False");
        facets.forEach((facet, value) -> sb.append(' ').append(facet).append('=').append(value));
        return sb.append(']').toString();
    }
}
