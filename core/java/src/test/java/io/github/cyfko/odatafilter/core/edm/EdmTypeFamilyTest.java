package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.model.TypeReference;
import io.github.cyfko.odatafilter.core.tree.BinaryOperatorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EdmTypeFamily and EdmPrimitiveTypes Tests")
class EdmTypeFamilyTest {

    @ParameterizedTest
    @CsvSource({
            "Edm.Int32,              NUMERIC",
            "Edm.Decimal,            NUMERIC",
            "Edm.Byte,               NUMERIC",
            "Edm.String,             STRING",
            "Edm.DateTimeOffset,     TEMPORAL",
            "Edm.Duration,           TEMPORAL",
            "Edm.Boolean,            BOOLEAN",
            "Edm.Guid,               GUID",
            "Edm.GeographyPoint,     SPATIAL",
            "Edm.GeometryPolygon,    SPATIAL",
            "Edm.Binary,             OTHER",
            "Test.Person,            OTHER"
    })
    @DisplayName("Should classify types into families")
    void shouldClassifyTypes(String typeName, EdmTypeFamily expected) {
        assertEquals(expected, EdmTypeFamily.of(TypeReference.of(typeName)));
    }

    @ParameterizedTest
    @CsvSource({
            "LESS_THAN,    Edm.Int32,          Edm.Double,         true",
            "EQUAL,        Edm.String,         Edm.String,         true",
            "GREATER_THAN, Edm.String,         Edm.Int32,          false",
            "EQUAL,        Edm.Boolean,        Edm.Boolean,        true",
            "LESS_THAN,    Edm.Boolean,        Edm.Boolean,        false",
            "NOT_EQUAL,    Edm.Guid,           Edm.Guid,           true",
            "GREATER_THAN_OR_EQUAL, Edm.Guid,  Edm.Guid,           false",
            "EQUAL,        Edm.GeographyPoint, Edm.GeographyPoint, false",
            "EQUAL,        Test.Person,        Test.Person,        false"
    })
    @DisplayName("Should decide comparability per operator")
    void shouldDecideComparability(BinaryOperatorKind operator, String left, String right, boolean expected) {
        assertEquals(expected, EdmTypeFamily.areComparable(operator, TypeReference.of(left), TypeReference.of(right)));
    }

    @Test
    @DisplayName("Logical operators should only be supported by the boolean family")
    void logicalOperatorsOnlyForBoolean() {
        assertTrue(EdmTypeFamily.BOOLEAN.supports(BinaryOperatorKind.AND));
        assertFalse(EdmTypeFamily.NUMERIC.supports(BinaryOperatorKind.OR));
    }

    @ParameterizedTest
    @CsvSource({
            "Edm.Int32,              Edm.Int64,          true",
            "Edm.Int64,              Edm.Int32,          false",
            "Edm.Int32,              Edm.Double,         true",
            "Edm.Byte,               Edm.Int16,          true",
            "Edm.Int64,              Edm.Decimal,        true",
            "Edm.Double,             Edm.Decimal,        false",
            "Edm.GeographyPoint,     Edm.Geography,      true",
            "Edm.GeometryPoint,      Edm.Geography,      false",
            "Edm.GeometryLineString, Edm.Geometry,       true",
            "Edm.String,             Edm.String,         true",
            "Edm.String,             Edm.Guid,           false"
    })
    @DisplayName("Should apply implicit conversions for overload matching")
    void shouldApplyImplicitConversions(String from, String to, boolean expected) {
        assertEquals(expected, EdmPrimitiveTypes.isAssignable(TypeReference.of(from), TypeReference.of(to)));
    }
}
