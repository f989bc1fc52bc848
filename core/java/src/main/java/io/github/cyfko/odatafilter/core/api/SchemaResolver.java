package io.github.cyfko.odatafilter.core.api;

import io.github.cyfko.odatafilter.core.exception.UnknownFunctionException;
import io.github.cyfko.odatafilter.core.exception.UnknownIdentifierException;
import io.github.cyfko.odatafilter.core.exception.UnknownPropertyException;
import io.github.cyfko.odatafilter.core.model.FunctionResolution;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.List;

/**
 * Read-only view of an entity data model, consulted by the parser for every identifier, property and
 * function of a filter expression.
 * <p>
 * Implementations must be synchronous and free of side effects: the parser calls them in strict
 * left-to-right, depth-first order and relies on identical answers for identical questions. The
 * {@link io.github.cyfko.odatafilter.core.edm.ModelSchemaResolver} implementation answers from an
 * in-memory {@link io.github.cyfko.odatafilter.core.edm.EdmModel}; tests typically supply hand-built stubs.
 * </p>
 *
 * <h2>Function overload matching</h2>
 * <ol>
 *   <li>An overload whose parameter type names equal the argument type names wins</li>
 *   <li>Otherwise the first overload, in declaration order, whose parameters are assignable from the
 *       arguments (numeric promotion inside the numeric family, concrete spatial types to their abstract
 *       base); there is no widening across families such as geography and numeric</li>
 * </ol>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface SchemaResolver {

    /**
     * @param name range variable name, {@code $}-prefixed
     * @return the variable bound under that name
     * @throws UnknownIdentifierException if no variable is bound under that name
     */
    RangeVariable resolveRangeVariable(String name) throws UnknownIdentifierException;

    /**
     * @param sourceType   type the property is looked up on
     * @param propertyName property name
     * @return declared type of the property
     * @throws UnknownPropertyException if {@code sourceType} declares no such property
     */
    TypeReference resolveProperty(TypeReference sourceType, String propertyName) throws UnknownPropertyException;

    /**
     * @param name          function name
     * @param argumentTypes types of the already typed arguments, in call order
     * @return the return type and the matched overload
     * @throws UnknownFunctionException if no overload accepts the argument types
     */
    FunctionResolution resolveFunction(String name, List<TypeReference> argumentTypes) throws UnknownFunctionException;
}
