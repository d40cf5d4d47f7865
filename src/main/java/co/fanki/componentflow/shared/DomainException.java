package co.fanki.componentflow.shared;

/**
 * Raised when a component-flow request cannot be served at all.
 *
 * <p>Per-file and per-reference failures never surface as exceptions;
 * they are reported as analysis errors. This exception is reserved for
 * request-level problems such as an unreadable project root or an
 * unusable parser runtime.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

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
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
