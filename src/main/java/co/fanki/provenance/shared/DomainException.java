package co.fanki.provenance.shared;

/**
 * Raised at the service boundary when a request cannot be honored.
 *
 * <p>The analysis core never raises it: unsupported AST shapes degrade
 * into unknown provenance nodes or dropped rows. Only input validation,
 * registry lookups and module map export fail with a domain exception,
 * each tagged with a stable error code that clients can switch on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The code used when the caller does not supply a specific one. */
    public static final String DEFAULT_CODE = "DOMAIN_ERROR";

    /** The AST document is not valid Babel JSON. */
    public static final String INVALID_AST = "INVALID_AST";

    /** The requested module has no graph in the current build. */
    public static final String MODULE_NOT_FOUND = "MODULE_NOT_FOUND";

    /** The module map could not be written. */
    public static final String EXPORT_FAILED = "EXPORT_FAILED";

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
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
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
