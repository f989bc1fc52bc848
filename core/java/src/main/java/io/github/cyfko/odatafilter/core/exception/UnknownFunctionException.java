package io.github.cyfko.odatafilter.core.exception;

import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no overload of a function accepts the argument types of a call, or when the function is not
 * declared at all.
 *
 * <pre>{@code
 * parser.parse("geo.distance(Home, 5) lt 0.5");
 * // → "No overload of function 'geo.distance' accepts (Edm.GeographyPoint, Edm.Int32) at position 0"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnknownFunctionException extends FilterException {

    private final String functionName;
    private final List<TypeReference> argumentTypes;

    public UnknownFunctionException(String functionName, List<TypeReference> argumentTypes, boolean declared) {
        super(ErrorKind.UNKNOWN_FUNCTION, declared
                ? "No overload of function '" + functionName + "' accepts " + describe(argumentTypes)
                : "Unknown function '" + functionName + "'", UNANCHORED);
        this.functionName = functionName;
        this.argumentTypes = List.copyOf(argumentTypes);
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<TypeReference> getArgumentTypes() {
        return argumentTypes;
    }

    private static String describe(List<TypeReference> types) {
        return types.stream().map(TypeReference::name).collect(Collectors.joining(", ", "(", ")"));
    }
}
