package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.shared.DomainException;

/**
 * Thrown when a dotted name cannot be bound to a live entity.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NameNotFoundException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this failure. */
    public static final String CODE = "NAME_NOT_FOUND";

    private final String name;
    private final String segment;
    private final int position;

    /**
     * Creates the exception for a failure on the first segment.
     *
     * @param theName the full dotted name being bound
     * @param theSegment the segment that could not be found
     * @param cause the underlying failure, may be null
     */
    public NameNotFoundException(final String theName,
            final String theSegment, final Throwable cause) {
        this(theName, theSegment, 0, cause);
    }

    /**
     * Creates the exception.
     *
     * @param theName the full dotted name being bound
     * @param theSegment the segment that could not be found
     * @param thePosition the zero based index of that segment in the name
     * @param cause the underlying failure, may be null
     */
    public NameNotFoundException(final String theName,
            final String theSegment, final int thePosition,
            final Throwable cause) {
        super("Cannot resolve '" + theName + "': no '" + theSegment + "'",
                CODE, cause);
        this.name = theName;
        this.segment = theSegment;
        this.position = thePosition;
    }

    /** Returns the full dotted name that was being bound. */
    public String getName() {
        return name;
    }

    /** Returns the segment that could not be found. */
    public String getSegment() {
        return segment;
    }

    /**
     * Returns where the missing segment sits in the name, so callers can
     * tell a missing module from a missing member.
     *
     * @return the zero based segment index
     */
    public int getPosition() {
        return position;
    }

}
