package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.api.SchemaResolver;
import io.github.cyfko.odatafilter.core.exception.UnknownFunctionException;
import io.github.cyfko.odatafilter.core.exception.UnknownIdentifierException;
import io.github.cyfko.odatafilter.core.exception.UnknownPropertyException;
import io.github.cyfko.odatafilter.core.model.FunctionResolution;
import io.github.cyfko.odatafilter.core.model.FunctionSignature;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link SchemaResolver} answering from an {@link EdmModel}.
 * <p>
 * Stateless apart from the immutable model, hence thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ModelSchemaResolver implements SchemaResolver {

    private static final Logger log = Logger.getLogger(ModelSchemaResolver.class.getName());

    private final EdmModel model;

    public ModelSchemaResolver(EdmModel model) {
        this.model = Objects.requireNonNull(model, "Model cannot be null");
    }

    public EdmModel getModel() {
        return model;
    }

    @Override
    public RangeVariable resolveRangeVariable(String name) {
        return model.rangeVariable(name).orElseThrow(() -> new UnknownIdentifierException(name));
    }

    @Override
    public TypeReference resolveProperty(TypeReference sourceType, String propertyName) {
        TypeReference type = model.structuredType(sourceType.name())
                .flatMap(structured -> structured.property(propertyName))
                .orElseThrow(() -> new UnknownPropertyException(propertyName, sourceType.name()));

        log.finer(() -> String.format("Resolved property %s/%s as %s", sourceType.name(), propertyName, type));
        return type;
    }

    @Override
    public FunctionResolution resolveFunction(String name, List<TypeReference> argumentTypes) {
        List<FunctionSignature> overloads = model.functionOverloads(name);
        if (overloads.isEmpty()) {
            throw new UnknownFunctionException(name, argumentTypes, false);
        }

        FunctionSignature match = null;
        for (FunctionSignature candidate : overloads) {
            if (matchesExactly(candidate, argumentTypes)) {
                match = candidate;
                break;
            }
        }
        if (match == null) {
            for (FunctionSignature candidate : overloads) {
                if (accepts(candidate, argumentTypes)) {
                    match = candidate;
                    break;
                }
            }
        }
        if (match == null) {
            throw new UnknownFunctionException(name, argumentTypes, true);
        }

        FunctionSignature resolved = match;
        log.finer(() -> String.format("Resolved function call %s%s to %s", name, argumentTypes, resolved));
        return FunctionResolution.of(resolved);
    }

    private static boolean matchesExactly(FunctionSignature signature, List<TypeReference> argumentTypes) {
        if (signature.arity() != argumentTypes.size()) {
            return false;
        }
        for (int i = 0; i < argumentTypes.size(); i++) {
            if (!argumentTypes.get(i).hasName(signature.parameterTypes().get(i).name())) {
                return false;
            }
        }
        return true;
    }

    private static boolean accepts(FunctionSignature signature, List<TypeReference> argumentTypes) {
        if (signature.arity() != argumentTypes.size()) {
            return false;
        }
        for (int i = 0; i < argumentTypes.size(); i++) {
            if (!EdmPrimitiveTypes.isAssignable(argumentTypes.get(i), signature.parameterTypes().get(i))) {
                return false;
            }
        }
        return true;
    }
}
