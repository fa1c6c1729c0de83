package gov.nih.ncats.dugr;

/**
 * Thrown for a non-positive viewing distance, background luminance or position index,
 * or an empty or degenerate luminance field.
 */
public class InvalidInputException extends GlareException {
    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
