package gov.nih.ncats.dugr;

/**
 * Base class of the errors that abort a glare evaluation.
 * No partial result is available when one of these is thrown.
 */
public class GlareException extends Exception {
    private static final long serialVersionUID = 1L;

    public GlareException(String message) {
        super(message);
    }

    public GlareException(String message, Throwable cause) {
        super(message, cause);
    }
}
