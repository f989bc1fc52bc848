package io.github.cyfko.odatafilter.core;

import io.github.cyfko.odatafilter.core.edm.EdmModel;
import io.github.cyfko.odatafilter.core.edm.EdmPrimitiveTypes;
import io.github.cyfko.odatafilter.core.edm.EdmStructuredType;
import io.github.cyfko.odatafilter.core.model.FunctionSignature;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.model.TypeReference;

/**
 * Shared model fixture: a {@code Test.Person} entity exposed through the {@code People} entity set.
 */
public final class TestModels {

    public static final String PERSON = "Test.Person";
    public static final String ADDRESS = "Test.Address";
    public static final String PEOPLE = "People";

    public static final TypeReference POINT_4326 = TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326);

    /** Model-declared function, as opposed to the canonical ones. */
    public static final FunctionSignature IS_NEAR = FunctionSignature.declared("Test.IsNear",
            TypeReference.of(EdmPrimitiveTypes.BOOLEAN),
            TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT),
            TypeReference.of(EdmPrimitiveTypes.GEOGRAPHY_POINT));

    private TestModels() {}

    public static EdmModel people() {
        return EdmModel.builder()
                .structuredType(EdmStructuredType.complex(ADDRESS)
                        .property("City", TypeReference.of(EdmPrimitiveTypes.STRING))
                        .property("Location", POINT_4326)
                        .build())
                .structuredType(EdmStructuredType.entity(PERSON)
                        .property("Home", POINT_4326)
                        .property("Office", POINT_4326)
                        .property("a", TypeReference.of(EdmPrimitiveTypes.INT32))
                        .property("b", TypeReference.of(EdmPrimitiveTypes.INT32))
                        .property("c", TypeReference.of(EdmPrimitiveTypes.INT32))
                        .property("Name", TypeReference.of(EdmPrimitiveTypes.STRING))
                        .property("Age", TypeReference.of(EdmPrimitiveTypes.INT32, false))
                        .property("IsActive", TypeReference.of(EdmPrimitiveTypes.BOOLEAN, false))
                        .property("Born", TypeReference.of(EdmPrimitiveTypes.DATE_TIME_OFFSET))
                        .property("Address", TypeReference.of(ADDRESS))
                        .build())
                .entitySet(PEOPLE, PERSON)
                .rangeVariable(RangeVariable.IT, PEOPLE)
                .withBuiltInFunctions()
                .function(IS_NEAR)
                .build();
    }

    public static RangeVariable it() {
        return people().rangeVariable(RangeVariable.IT).orElseThrow();
    }
}
