package io.github.cyfko.odatafilter.core.exception;

import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.List;

/**
 * Thrown when an operator rejects the types of its operands, or when the whole filter is not boolean.
 *
 * <pre>{@code
 * parser.parse("Home lt Office");
 * // → "Operator 'lt' cannot be applied to operands of type Edm.GeographyPoint and Edm.GeographyPoint at position 5"
 *
 * parser.parse("Name eq 5");
 * // → "Operator 'eq' cannot be applied to operands of type Edm.String and Edm.Int32 at position 5"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TypeMismatchException extends FilterException {

    private final String operatorName;
    private final List<TypeReference> conflictingTypes;

    public TypeMismatchException(String message, String operatorName, List<TypeReference> conflictingTypes, int offset) {
        super(ErrorKind.TYPE_MISMATCH, message, offset);
        this.operatorName = operatorName;
        this.conflictingTypes = List.copyOf(conflictingTypes);
    }

    public static TypeMismatchException forOperands(String operator, TypeReference left, TypeReference right, int offset) {
        return new TypeMismatchException(
                "Operator '" + operator + "' cannot be applied to operands of type " + left.name() + " and " + right.name(),
                operator, List.of(left, right), offset);
    }

    public static TypeMismatchException forOperand(String operator, TypeReference operand, String expectedType, int offset) {
        return new TypeMismatchException(
                "Operator '" + operator + "' requires an operand of type " + expectedType + ", got " + operand.name(),
                operator, List.of(operand), offset);
    }

    /**
     * @return the operator keyword ({@code lt}, {@code and}, {@code not}) or {@code $filter} for the root check
     */
    public String getOperatorName() {
        return operatorName;
    }

    public List<TypeReference> getConflictingTypes() {
        return conflictingTypes;
    }
}
