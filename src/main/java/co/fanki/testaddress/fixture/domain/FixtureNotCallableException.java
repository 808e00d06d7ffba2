package co.fanki.testaddress.fixture.domain;

import co.fanki.testaddress.shared.DomainException;

/**
 * Thrown when a fixture name is present on an object but does not name a
 * method that can be called as a fixture.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FixtureNotCallableException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this failure. */
    public static final String CODE = "FIXTURE_NOT_CALLABLE";

    /**
     * Creates the exception.
     *
     * @param name the fixture name
     * @param target the object the fixture was looked up on
     * @param cause the underlying failure, may be null
     */
    public FixtureNotCallableException(final String name, final Object target,
            final Throwable cause) {
        super("Attribute " + name + " of " + target + " is not a method."
                + " Only methods taking no arguments, or the module for"
                + " module fixtures, may be used as fixtures.", CODE, cause);
    }

}
