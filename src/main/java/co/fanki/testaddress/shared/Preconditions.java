package co.fanki.testaddress.shared;

import java.util.regex.Pattern;

/**
 * Argument checks shared by the value objects and services.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    /** A dotted sequence of Java identifiers, e.g. {@code com.acme.FooTest}. */
    private static final Pattern DOTTED_NAME = Pattern.compile(
            "^[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*$");

    private Preconditions() {
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks whether a value is a dotted sequence of identifiers.
     *
     * @param value the value to check, may be null
     * @return true if the value is a valid dotted name
     */
    public static boolean isDottedName(final String value) {
        return value != null && DOTTED_NAME.matcher(value).matches();
    }

    /**
     * Ensures that a string is a dotted sequence of identifiers.
     *
     * @param value the string to check
     * @param message the exception message if the check fails
     * @return the dotted name
     * @throws IllegalArgumentException if value is not a dotted name
     */
    public static String requireDottedName(final String value,
            final String message) {
        if (!isDottedName(value)) {
            throw new IllegalArgumentException(message + ": " + value);
        }
        return value;
    }

}
