package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.TestModels;
import io.github.cyfko.odatafilter.core.model.FunctionSignature;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.model.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EdmModel Tests")
class EdmModelTest {

    private static EdmStructuredType person() {
        return EdmStructuredType.entity(TestModels.PERSON)
                .property("Name", TypeReference.of(EdmPrimitiveTypes.STRING))
                .build();
    }

    @Test
    @DisplayName("Should expose declared types, entity sets and range variables")
    void shouldExposeDeclarations() {
        // When
        EdmModel model = TestModels.people();

        // Then
        assertTrue(model.structuredType(TestModels.PERSON).isPresent());
        assertEquals(EdmStructuredType.Kind.COMPLEX, model.structuredType(TestModels.ADDRESS).orElseThrow().kind());
        assertEquals(TestModels.PERSON, model.entitySetType(TestModels.PEOPLE).orElseThrow());
        assertEquals(TypeReference.of(TestModels.PERSON, false), model.rangeVariable(RangeVariable.IT).orElseThrow().typeReference());
        assertTrue(model.functionNames().contains("geo.distance"));
        assertTrue(model.functionNames().contains("Test.IsNear"));
        assertTrue(model.functionOverloads("geo.area").isEmpty());
    }

    @Test
    @DisplayName("Built-in functions should keep their declaration order")
    void shouldKeepOverloadOrder() {
        // When
        EdmModel model = EdmModel.builder().withBuiltInFunctions().build();

        // Then
        assertEquals(2, model.functionOverloads("geo.distance").size());
        assertEquals(EdmPrimitiveTypes.GEOGRAPHY_POINT,
                model.functionOverloads("geo.distance").get(0).parameterTypes().get(0).name());
        assertTrue(model.functionOverloads("contains").get(0).builtIn());
    }

    @Test
    @DisplayName("Should reject duplicate declarations")
    void shouldRejectDuplicates() {
        assertThrows(IllegalArgumentException.class,
                () -> EdmModel.builder().structuredType(person()).structuredType(person()));
        assertThrows(IllegalArgumentException.class,
                () -> EdmModel.builder().entitySet("People", TestModels.PERSON).entitySet("People", TestModels.PERSON));
        assertThrows(IllegalArgumentException.class,
                () -> EdmModel.builder().function(TestModels.IS_NEAR).function(TestModels.IS_NEAR));
        assertThrows(IllegalArgumentException.class,
                () -> EdmStructuredType.entity(TestModels.PERSON)
                        .property("Name", TypeReference.of(EdmPrimitiveTypes.STRING))
                        .property("Name", TypeReference.of(EdmPrimitiveTypes.INT32)));
    }

    @Test
    @DisplayName("Should reject dangling references at build time")
    void shouldRejectDanglingReferences() {
        // Property type not declared
        assertThrows(IllegalArgumentException.class, () -> EdmModel.builder()
                .structuredType(EdmStructuredType.entity(TestModels.PERSON)
                        .property("Address", TypeReference.of(TestModels.ADDRESS))
                        .build())
                .build());

        // Entity set over an undeclared type
        assertThrows(IllegalArgumentException.class, () -> EdmModel.builder()
                .entitySet("People", TestModels.PERSON)
                .build());

        // Range variable over an undeclared entity set
        assertThrows(IllegalArgumentException.class, () -> EdmModel.builder()
                .structuredType(person())
                .rangeVariable(RangeVariable.IT, "People")
                .build());
    }

    @Test
    @DisplayName("Entity sets should only range over entity types")
    void shouldRejectEntitySetOverComplexType() {
        assertThrows(IllegalArgumentException.class, () -> EdmModel.builder()
                .structuredType(EdmStructuredType.complex(TestModels.ADDRESS).build())
                .entitySet("Addresses", TestModels.ADDRESS)
                .build());
    }

    @Test
    @DisplayName("Should reject invalid names")
    void shouldRejectInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> EdmModel.builder().entitySet("1People", TestModels.PERSON));
        assertThrows(IllegalArgumentException.class, () -> EdmModel.builder().rangeVariable("it", "People"));
        assertThrows(IllegalArgumentException.class, () -> EdmStructuredType.entity("Edm.Person").build());
        assertThrows(IllegalArgumentException.class, () -> EdmModel.builder().function(
                FunctionSignature.declared("bad-name", TypeReference.of(EdmPrimitiveTypes.BOOLEAN))));
    }
}
