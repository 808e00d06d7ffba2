package co.fanki.testaddress.shared;

/**
 * Base exception for every named resolution failure.
 *
 * <p>Each failure carries an error code so that callers, the REST layer in
 * particular, can tell a malformed specifier from a missing name without
 * parsing messages.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when no specific code is given. */
    public static final String DEFAULT_CODE = "DOMAIN_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with the default error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, DEFAULT_CODE);
    }

    /**
     * Creates a new domain exception with a specific error code.
     *
     * @param message the error message
     * @param theErrorCode the error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with a specific error code and cause.
     *
     * @param message the error message
     * @param theErrorCode the error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
