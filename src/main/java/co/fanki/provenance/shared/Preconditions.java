package co.fanki.provenance.shared;

/**
 * Argument validation for the service boundary.
 *
 * <p>Every check throws {@link IllegalArgumentException}, which the
 * controllers report as a bad request together with
 * {@link DomainException}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
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
     * Ensures that a source line number is usable, lines are 1-indexed.
     *
     * @param line the line to check
     * @param message the exception message if the line is not positive
     * @return the line
     * @throws IllegalArgumentException if line is zero or negative
     */
    public static int requireLine(final int line, final String message) {
        if (line <= 0) {
            throw new IllegalArgumentException(message);
        }
        return line;
    }

}
