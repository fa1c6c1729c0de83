package gov.nih.ncats.dugr;

/**
 * Thrown when no pixel of the field reaches the detection threshold.
 */
public class NoLuminousAreaException extends GlareException {
    private static final long serialVersionUID = 1L;

    private final double threshold;
    private final double maxLuminance;

    public NoLuminousAreaException(double threshold, double maxLuminance) {
        super("no luminous area found: threshold " + threshold
                + " cd/m2 but maximum luminance is " + maxLuminance + " cd/m2");
        this.threshold = threshold;
        this.maxLuminance = maxLuminance;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMaxLuminance() {
        return maxLuminance;
    }
}
