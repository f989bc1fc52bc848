package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.config.PatternConfig;
import io.github.cyfko.odatafilter.core.model.FunctionSignature;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, in-memory entity data model: structured types, entity sets, range variable bindings and
 * function overloads.
 * <p>
 * The model stands in for the EDM layer of a full OData stack, which would load it from CSDL metadata. It is
 * built once through {@link #builder()}, validated as a whole by {@link Builder#build()}, and may then be
 * shared freely between threads and parsers.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * EdmModel model = EdmModel.builder()
 *     .structuredType(EdmStructuredType.entity("Test.Person")
 *         .property("Home", TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326))
 *         .property("Office", TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326))
 *         .build())
 *     .entitySet("People", "Test.Person")
 *     .rangeVariable(RangeVariable.IT, "People")
 *     .withBuiltInFunctions()
 *     .build();
 * }</pre>
 *
 * <p><strong>Validation performed by {@code build()}:</strong></p>
 * <ul>
 *   <li>Every non-primitive property type is a declared structured type</li>
 *   <li>Every entity set refers to a declared entity type</li>
 *   <li>Every range variable refers to a declared entity set</li>
 *   <li>Function overloads of one name differ in their parameter types</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EdmModel {

    private final Map<String, EdmStructuredType> structuredTypes;
    private final Map<String, String> entitySets;
    private final Map<String, RangeVariable> rangeVariables;
    private final Map<String, List<FunctionSignature>> functions;

    private EdmModel(Builder builder) {
        this.structuredTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.structuredTypes));
        this.entitySets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.entitySets));

        Map<String, RangeVariable> variables = new LinkedHashMap<>();
        builder.rangeVariables.forEach((variable, entitySet) -> variables.put(variable,
                new RangeVariable(variable, entitySet, TypeReference.of(entitySets.get(entitySet), false))));
        this.rangeVariables = Collections.unmodifiableMap(variables);

        Map<String, List<FunctionSignature>> overloads = new LinkedHashMap<>();
        builder.functions.forEach((name, signatures) -> overloads.put(name, List.copyOf(signatures)));
        this.functions = Collections.unmodifiableMap(overloads);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<EdmStructuredType> structuredType(String qualifiedName) {
        return Optional.ofNullable(structuredTypes.get(qualifiedName));
    }

    /**
     * @return the entity type name of the entity set, if declared
     */
    public Optional<String> entitySetType(String entitySet) {
        return Optional.ofNullable(entitySets.get(entitySet));
    }

    public Optional<RangeVariable> rangeVariable(String name) {
        return Optional.ofNullable(rangeVariables.get(name));
    }

    /**
     * @return the overloads of the function in declaration order, empty if the function is not declared
     */
    public List<FunctionSignature> functionOverloads(String name) {
        return functions.getOrDefault(name, List.of());
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public static final class Builder {
        private final Map<String, EdmStructuredType> structuredTypes = new LinkedHashMap<>();
        private final Map<String, String> entitySets = new LinkedHashMap<>();
        private final Map<String, String> rangeVariables = new LinkedHashMap<>();
        private final Map<String, List<FunctionSignature>> functions = new LinkedHashMap<>();

        private Builder() {}

        public Builder structuredType(EdmStructuredType type) {
            if (structuredTypes.putIfAbsent(type.name(), type) != null) {
                throw new IllegalArgumentException("Type [" + type.name() + "] is already declared.");
            }
            return this;
        }

        public Builder entitySet(String name, String entityTypeName) {
            if (name == null || !PatternConfig.SIMPLE_IDENTIFIER_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid entity set name: " + name);
            }
            if (entitySets.putIfAbsent(name, entityTypeName) != null) {
                throw new IllegalArgumentException("Entity set [" + name + "] is already declared.");
            }
            return this;
        }

        /**
         * Binds a range variable to the items of an entity set.
         */
        public Builder rangeVariable(String name, String entitySet) {
            if (name == null || !PatternConfig.RANGE_VARIABLE_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid range variable name: " + name);
            }
            if (rangeVariables.putIfAbsent(name, entitySet) != null) {
                throw new IllegalArgumentException("Range variable [" + name + "] is already bound.");
            }
            return this;
        }

        /**
         * Declares one overload of a function. Overloads are matched in declaration order.
         */
        public Builder function(FunctionSignature signature) {
            if (!PatternConfig.QUALIFIED_NAME_PATTERN.matcher(signature.name()).matches()) {
                throw new IllegalArgumentException("Invalid function name: " + signature.name());
            }
            List<FunctionSignature> overloads = functions.computeIfAbsent(signature.name(), key -> new ArrayList<>());
            for (FunctionSignature existing : overloads) {
                if (sameParameterTypes(existing, signature)) {
                    throw new IllegalArgumentException("Overload " + signature + " is already declared.");
                }
            }
            overloads.add(signature);
            return this;
        }

        /**
         * Declares the OData canonical functions listed by {@link BuiltInFunctions}.
         */
        public Builder withBuiltInFunctions() {
            BuiltInFunctions.signatures().forEach(this::function);
            return this;
        }

        public EdmModel build() {
            structuredTypes.values().forEach(type -> type.properties().forEach((property, propertyType) -> {
                if (!propertyType.isPrimitive() && !structuredTypes.containsKey(propertyType.name())) {
                    throw new IllegalArgumentException("Property [" + type.name() + "/" + property
                            + "] refers to undeclared type " + propertyType.name());
                }
            }));
            entitySets.forEach((set, typeName) -> {
                EdmStructuredType type = structuredTypes.get(typeName);
                if (type == null || type.kind() != EdmStructuredType.Kind.ENTITY) {
                    throw new IllegalArgumentException("Entity set [" + set + "] refers to undeclared entity type " + typeName);
                }
            });
            rangeVariables.forEach((variable, set) -> {
                if (!entitySets.containsKey(set)) {
                    throw new IllegalArgumentException("Range variable [" + variable + "] refers to undeclared entity set " + set);
                }
            });
            return new EdmModel(this);
        }

        private static boolean sameParameterTypes(FunctionSignature a, FunctionSignature b) {
            if (a.arity() != b.arity()) {
                return false;
            }
            for (int i = 0; i < a.arity(); i++) {
                if (!a.parameterTypes().get(i).hasName(b.parameterTypes().get(i).name())) {
                    return false;
                }
            }
            return true;
        }
    }
}
