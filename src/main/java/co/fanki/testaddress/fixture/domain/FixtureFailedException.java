package co.fanki.testaddress.fixture.domain;

import co.fanki.testaddress.shared.DomainException;

/**
 * Wraps a checked exception thrown by a fixture.
 *
 * <p>Unchecked exceptions thrown by a fixture are propagated unchanged.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FixtureFailedException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this failure. */
    public static final String CODE = "FIXTURE_FAILED";

    /**
     * Creates the exception.
     *
     * @param name the fixture name
     * @param target the object the fixture ran on
     * @param cause what the fixture threw
     */
    public FixtureFailedException(final String name, final Object target,
            final Throwable cause) {
        super("Fixture " + name + " of " + target + " failed: "
                + cause.getMessage(), CODE, cause);
    }

}
