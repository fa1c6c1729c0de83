package gov.nih.ncats.dugr.image.binarization;

import java.util.Objects;

import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceField;
import gov.nih.ncats.dugr.image.LuminanceStats;

/**
 * Luminance threshold separating the luminous surface from its background.
 */
public final class DetectionThreshold {
    /**
     * Threshold luminance of CIE 232 in cd/m&sup2;.
     */
    public static final double DEFAULT_ABSOLUTE_THRESHOLD = 500.;
    public static final double DEFAULT_FRACTION = 0.1;

    private final ThresholdPolicy policy;
    private final double value;

    private DetectionThreshold(ThresholdPolicy policy, double value){
        this.policy = Objects.requireNonNull(policy);
        if(Double.isNaN(value) || Double.isInfinite(value) || value <0){
            throw new IllegalArgumentException("threshold value must be a non-negative number: " + value);
        }
        if(policy!=ThresholdPolicy.ABSOLUTE && value >1){
            throw new IllegalArgumentException("threshold fraction must be in [0,1]: " + value);
        }
        this.value = value;
    }

    public static DetectionThreshold absolute(double luminance){
        return new DetectionThreshold(ThresholdPolicy.ABSOLUTE, luminance);
    }

    public static DetectionThreshold relative(double fractionOfMax){
        return new DetectionThreshold(ThresholdPolicy.RELATIVE, fractionOfMax);
    }

    public static DetectionThreshold rangeFraction(double fraction){
        return new DetectionThreshold(ThresholdPolicy.RANGE_FRACTION, fraction);
    }

    public static DetectionThreshold defaultThreshold(){
        return absolute(DEFAULT_ABSOLUTE_THRESHOLD);
    }

    public ThresholdPolicy getPolicy() {
        return policy;
    }

    public double getValue() {
        return value;
    }

    /**
     * The threshold luminance for a field with the given statistics.
     */
    public double resolve(LuminanceStats stats){
        return policy.resolve(value, stats);
    }

    /**
     * Set every valid pixel whose luminance is greater than or equal to the threshold.
     */
    public static Bitmap globalThreshold(LuminanceField field, double threshold){
        Bitmap bm = new Bitmap(field.width(), field.height());
        for (int y = 0; y < field.height(); ++y) {
            for (int x = 0; x < field.width(); ++x) {
                bm.set(x, y, field.isValid(x,y) && field.get(x,y) >= threshold);
            }
        }
        return bm;
    }

    @Override
    public String toString(){
        return policy + "(" + value + ")";
    }
}
