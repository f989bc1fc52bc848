package io.github.cyfko.odatafilter.core.model;

import io.github.cyfko.odatafilter.core.edm.EdmPrimitiveTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TypeReference Tests")
class TypeReferenceTest {

    @Test
    @DisplayName("Should render name, nullability and facets")
    void shouldRenderFacets() {
        assertEquals("[Test.Person Nullable=False]", TypeReference.of("Test.Person", false).toString());
        assertEquals("[Edm.Double Nullable=True]", TypeReference.of(EdmPrimitiveTypes.DOUBLE).toString());
        assertEquals("[Edm.GeographyPoint Nullable=True SRID=4326]",
                TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326).toString());
    }

    @Test
    @DisplayName("Should compare by value, facets included")
    void shouldCompareByValue() {
        // Given
        TypeReference point = TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326);

        // Then
        assertEquals(point, TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326));
        assertNotEquals(point, TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT));
        assertNotEquals(point, point.asNullable(false));
        assertEquals(OptionalInt.of(4326), point.srid());
        assertEquals(OptionalInt.empty(), TypeReference.of(EdmPrimitiveTypes.STRING).srid());
    }

    @Test
    @DisplayName("Nullability changes should keep facets")
    void asNullableKeepsFacets() {
        // Given
        TypeReference point = TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326);

        // When
        TypeReference nonNullable = point.asNullable(false);

        // Then
        assertFalse(nonNullable.nullable());
        assertEquals(point.facets(), nonNullable.facets());
        assertSame(point, point.asNullable(true));
    }

    @Test
    @DisplayName("Should tell primitive types from structured ones")
    void shouldDetectPrimitives() {
        assertTrue(TypeReference.of(EdmPrimitiveTypes.INT32).isPrimitive());
        assertFalse(TypeReference.of("Test.Person").isPrimitive());
    }

    @Test
    @DisplayName("Facets should be immutable")
    void facetsAreImmutable() {
        TypeReference point = TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326);
        assertThrows(UnsupportedOperationException.class, () -> point.facets().put("SRID", "0"));
    }

    @Test
    @DisplayName("A variable SRID should have no numeric value")
    void variableSridHasNoValue() {
        // When
        TypeReference point = TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT)
                .withFacet(TypeReference.SRID, TypeReference.SRID_VARIABLE);

        // Then
        assertEquals(OptionalInt.empty(), point.srid());
        assertEquals("[Edm.GeographyPoint Nullable=True SRID=variable]", point.toString());
    }

    @Test
    @DisplayName("Should reject SRID values that are neither numeric nor variable")
    void shouldRejectInvalidSrid() {
        // Given
        TypeReference point = TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT);

        // Then
        assertThrows(IllegalArgumentException.class, () -> point.withFacet(TypeReference.SRID, "WGS84"));
        assertThrows(IllegalArgumentException.class, () -> TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, -1));
    }

    @Test
    @DisplayName("Should reject blank names")
    void shouldRejectBlankNames() {
        assertThrows(IllegalArgumentException.class, () -> TypeReference.of(" "));
    }

    @Test
    @DisplayName("Function signatures should render their parameter types")
    void signatureToString() {
        // When
        FunctionSignature signature = FunctionSignature.declared("Test.IsNear", TypeReference.of(EdmPrimitiveTypes.BOOLEAN),
                TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT), TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT));

        // Then
        assertEquals("Test.IsNear(Edm.GeographyPoint, Edm.GeographyPoint) -> Edm.Boolean", signature.toString());
        assertEquals(2, signature.arity());
        assertEquals(List.of(TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT), TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT)),
                signature.parameterTypes());
    }
}
