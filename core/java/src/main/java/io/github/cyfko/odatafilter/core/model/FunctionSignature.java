package io.github.cyfko.odatafilter.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One overload of a function callable from a filter expression.
 *
 * @param name           function name as written in the filter ({@code geo.distance}, {@code Test.Nearest})
 * @param returnType     type of the call result
 * @param parameterTypes parameter types, in order
 * @param builtIn        {@code true} for OData canonical functions, {@code false} for functions declared by a model
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionSignature(String name, TypeReference returnType, List<TypeReference> parameterTypes, boolean builtIn) {

    public FunctionSignature {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name is required");
        }
        if (returnType == null) {
            throw new IllegalArgumentException("Return type is required for function " + name);
        }
        parameterTypes = List.copyOf(parameterTypes);
    }

    public static FunctionSignature builtIn(String name, TypeReference returnType, TypeReference... parameterTypes) {
        return new FunctionSignature(name, returnType, List.of(parameterTypes), true);
    }

    public static FunctionSignature declared(String name, TypeReference returnType, TypeReference... parameterTypes) {
        return new FunctionSignature(name, returnType, List.of(parameterTypes), false);
    }

    public int arity() {
        return parameterTypes.size();
    }

    @Override
    public String toString() {
        return parameterTypes.stream()
                .map(TypeReference::name)
                .collect(Collectors.joining(", ", name + "(", ") -> " + returnType.name()));
    }
}
