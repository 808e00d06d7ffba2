package co.fanki.testaddress.specifier.domain;

import co.fanki.testaddress.shared.DomainException;

/**
 * Thrown when a test specifier cannot be split into location and callable.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MalformedSpecifierException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this failure. */
    public static final String CODE = "MALFORMED_SPECIFIER";

    private final String specifier;

    /**
     * Creates the exception.
     *
     * @param theSpecifier the offending specifier, may be null
     */
    public MalformedSpecifierException(final String theSpecifier) {
        super(message(theSpecifier), CODE);
        this.specifier = theSpecifier;
    }

    /**
     * Creates the exception with the failure that made the specifier
     * unusable.
     *
     * @param theSpecifier the offending specifier
     * @param cause the underlying failure
     */
    public MalformedSpecifierException(final String theSpecifier,
            final Throwable cause) {
        super(message(theSpecifier), CODE, cause);
        this.specifier = theSpecifier;
    }

    /**
     * Returns the specifier that could not be parsed.
     *
     * @return the specifier as given, may be null
     */
    public String getSpecifier() {
        return specifier;
    }

    private static String message(final String specifier) {
        return "Test name '" + specifier + "' could not be parsed. Please"
                + " format test names as path:callable or module:callable.";
    }

}
