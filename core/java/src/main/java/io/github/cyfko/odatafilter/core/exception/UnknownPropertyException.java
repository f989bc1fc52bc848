package io.github.cyfko.odatafilter.core.exception;

/**
 * Thrown when a property path segment does not name a property of the type it is applied to.
 * <p>
 * Primitive types have no properties: {@code Name/Length} fails with the searched type {@code Edm.String}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnknownPropertyException extends FilterException {

    private final String propertyName;
    private final String typeName;

    public UnknownPropertyException(String propertyName, String typeName) {
        super(ErrorKind.UNKNOWN_PROPERTY, "Unknown property '" + propertyName + "' on type '" + typeName + "'", UNANCHORED);
        this.propertyName = propertyName;
        this.typeName = typeName;
    }

    public String getPropertyName() {
        return propertyName;
    }

    /**
     * @return qualified name of the type that was searched
     */
    public String getTypeName() {
        return typeName;
    }
}
