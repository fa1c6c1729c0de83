package gov.nih.ncats.dugr.image.binarization;

import gov.nih.ncats.dugr.image.LuminanceStats;

/**
 * How the configured detection value is turned into a luminance threshold.
 */
public enum ThresholdPolicy {
    /**
     * The value is a luminance in cd/m&sup2;.
     */
    ABSOLUTE{
        @Override
        double resolve(double value, LuminanceStats stats) {
            return value;
        }
    },
    /**
     * The value is a fraction of the maximum luminance.
     */
    RELATIVE{
        @Override
        double resolve(double value, LuminanceStats stats) {
            return stats.max*value;
        }
    },
    /**
     * The value is a fraction of the range between minimum and maximum luminance.
     */
    RANGE_FRACTION{
        @Override
        double resolve(double value, LuminanceStats stats) {
            return stats.min + (stats.max-stats.min)*value;
        }
    }
    ;

    abstract double resolve(double value, LuminanceStats stats);
}
