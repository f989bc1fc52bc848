package io.github.cyfko.odatafilter.core.model;

import java.util.Objects;

/**
 * Outcome of a successful function lookup: the return type of the call and the overload it matched.
 *
 * @param returnType       resolved return type
 * @param matchedSignature overload selected for the argument types
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionResolution(TypeReference returnType, FunctionSignature matchedSignature) {

    public FunctionResolution {
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(matchedSignature, "matchedSignature");
    }

    public static FunctionResolution of(FunctionSignature signature) {
        return new FunctionResolution(signature.returnType(), signature);
    }
}
