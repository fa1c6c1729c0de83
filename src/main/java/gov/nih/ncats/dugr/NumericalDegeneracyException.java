package gov.nih.ncats.dugr;

/**
 * Thrown when the glare formula would have to take the logarithm of zero,
 * for example because the luminous area has no solid angle.
 */
public class NumericalDegeneracyException extends GlareException {
    private static final long serialVersionUID = 1L;

    public NumericalDegeneracyException(String message) {
        super(message);
    }
}
