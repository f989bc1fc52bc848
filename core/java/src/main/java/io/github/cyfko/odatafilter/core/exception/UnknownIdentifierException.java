package io.github.cyfko.odatafilter.core.exception;

/**
 * Thrown when a {@code $}-prefixed identifier does not name a range variable bound in the current scope.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnknownIdentifierException extends FilterException {

    private final String identifier;

    public UnknownIdentifierException(String identifier) {
        super(ErrorKind.UNKNOWN_IDENTIFIER, "Unknown identifier '" + identifier + "': no such range variable in scope", UNANCHORED);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
