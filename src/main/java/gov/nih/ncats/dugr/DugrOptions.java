package gov.nih.ncats.dugr;

import java.util.Objects;

import gov.nih.ncats.dugr.image.binarization.DetectionThreshold;

/**
 * Immutable algorithm configuration of a glare evaluation.
 * Use {@link #builder()} to change any of the defaults.
 *
 * @see GlareContext for the per measurement observer and photometric parameters.
 */
public final class DugrOptions {

    /**
     * Limiting resolution angle of the eye, 2.5 arc minutes.
     */
    public static final double DEFAULT_EYE_RESOLUTION = Math.toRadians(2.5/60);
    public static final double DEFAULT_BLUR_ACCURACY = 0.002;
    public static final int DEFAULT_CLOSING_RADIUS = 1;
    public static final double DEFAULT_UNIFORMITY_TOLERANCE = 0.25;
    public static final int DEFAULT_MAX_PARTIAL_AREAS = 5;
    public static final int DEFAULT_MIN_PIXELS_PER_AREA = 9;
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 4;
    public static final int DEFAULT_MAX_SEARCH_ITERATIONS = 16;

    private static final DugrOptions DEFAULT_OPTIONS = builder().build();

    private final double eyeResolutionAngle;
    private final double blurAccuracy;
    private final DetectionThreshold detectionThreshold;
    private final int closingRadius;
    private final double uniformityTolerance;
    private final int maxPartialAreas;
    private final int minPixelsPerArea;
    private final int maxRecursionDepth;
    private final int maxSearchIterations;
    private final boolean parallel;

    private DugrOptions(Builder b){
        this.eyeResolutionAngle = b.eyeResolutionAngle;
        this.blurAccuracy = b.blurAccuracy;
        this.detectionThreshold = b.detectionThreshold;
        this.closingRadius = b.closingRadius;
        this.uniformityTolerance = b.uniformityTolerance;
        this.maxPartialAreas = b.maxPartialAreas;
        this.minPixelsPerArea = b.minPixelsPerArea;
        this.maxRecursionDepth = b.maxRecursionDepth;
        this.maxSearchIterations = b.maxSearchIterations;
        this.parallel = b.parallel;
    }

    public static DugrOptions defaults(){
        return DEFAULT_OPTIONS;
    }

    public static Builder builder(){
        return new Builder();
    }

    /**
     * A builder initialized with the values of these options.
     */
    public Builder toBuilder(){
        return new Builder()
                .setEyeResolutionAngle(eyeResolutionAngle)
                .setBlurAccuracy(blurAccuracy)
                .setDetectionThreshold(detectionThreshold)
                .setClosingRadius(closingRadius)
                .setUniformityTolerance(uniformityTolerance)
                .setMaxPartialAreas(maxPartialAreas)
                .setMinPixelsPerArea(minPixelsPerArea)
                .setMaxRecursionDepth(maxRecursionDepth)
                .setMaxSearchIterations(maxSearchIterations)
                .setParallel(parallel);
    }

    /**
     * Full width at half maximum of the simulated blur in radians.
     */
    public double getEyeResolutionAngle() {
        return eyeResolutionAngle;
    }

    public double getBlurAccuracy() {
        return blurAccuracy;
    }

    public DetectionThreshold getDetectionThreshold() {
        return detectionThreshold;
    }

    public int getClosingRadius() {
        return closingRadius;
    }

    /**
     * Largest stdev/mean ratio for which a partial area counts as uniform.
     */
    public double getUniformityTolerance() {
        return uniformityTolerance;
    }

    public int getMaxPartialAreas() {
        return maxPartialAreas;
    }

    public int getMinPixelsPerArea() {
        return minPixelsPerArea;
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public int getMaxSearchIterations() {
        return maxSearchIterations;
    }

    public boolean isParallel() {
        return parallel;
    }

    @Override
    public String toString() {
        return "DugrOptions{" +
                "eyeResolutionAngle=" + eyeResolutionAngle +
                ", blurAccuracy=" + blurAccuracy +
                ", detectionThreshold=" + detectionThreshold +
                ", closingRadius=" + closingRadius +
                ", uniformityTolerance=" + uniformityTolerance +
                ", maxPartialAreas=" + maxPartialAreas +
                ", minPixelsPerArea=" + minPixelsPerArea +
                ", maxRecursionDepth=" + maxRecursionDepth +
                ", maxSearchIterations=" + maxSearchIterations +
                ", parallel=" + parallel +
                '}';
    }

    public static final class Builder{
        private double eyeResolutionAngle = DEFAULT_EYE_RESOLUTION;
        private double blurAccuracy = DEFAULT_BLUR_ACCURACY;
        private DetectionThreshold detectionThreshold = DetectionThreshold.defaultThreshold();
        private int closingRadius = DEFAULT_CLOSING_RADIUS;
        private double uniformityTolerance = DEFAULT_UNIFORMITY_TOLERANCE;
        private int maxPartialAreas = DEFAULT_MAX_PARTIAL_AREAS;
        private int minPixelsPerArea = DEFAULT_MIN_PIXELS_PER_AREA;
        private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
        private int maxSearchIterations = DEFAULT_MAX_SEARCH_ITERATIONS;
        private boolean parallel;

        private Builder(){
        }

        public Builder setEyeResolutionAngle(double radians) {
            if(!(radians >0) || Double.isInfinite(radians)){
                throw new IllegalArgumentException("eye resolution angle must be positive: " + radians);
            }
            this.eyeResolutionAngle = radians;
            return this;
        }

        public Builder setBlurAccuracy(double accuracy) {
            if(!(accuracy >0 && accuracy <1)){
                throw new IllegalArgumentException("blur accuracy must be in (0,1): " + accuracy);
            }
            this.blurAccuracy = accuracy;
            return this;
        }

        public Builder setDetectionThreshold(DetectionThreshold threshold) {
            this.detectionThreshold = Objects.requireNonNull(threshold);
            return this;
        }

        public Builder setClosingRadius(int radius) {
            if(radius <0){
                throw new IllegalArgumentException("closing radius can not be negative: " + radius);
            }
            this.closingRadius = radius;
            return this;
        }

        public Builder setUniformityTolerance(double tolerance) {
            if(!(tolerance >=0) || Double.isInfinite(tolerance)){
                throw new IllegalArgumentException("uniformity tolerance must be >= 0: " + tolerance);
            }
            this.uniformityTolerance = tolerance;
            return this;
        }

        public Builder setMaxPartialAreas(int max) {
            if(max <1){
                throw new IllegalArgumentException("max partial areas must be >= 1: " + max);
            }
            this.maxPartialAreas = max;
            return this;
        }

        public Builder setMinPixelsPerArea(int min) {
            if(min <1){
                throw new IllegalArgumentException("min pixels per area must be >= 1: " + min);
            }
            this.minPixelsPerArea = min;
            return this;
        }

        public Builder setMaxRecursionDepth(int depth) {
            if(depth <0){
                throw new IllegalArgumentException("max recursion depth can not be negative: " + depth);
            }
            this.maxRecursionDepth = depth;
            return this;
        }

        public Builder setMaxSearchIterations(int iterations) {
            if(iterations <1){
                throw new IllegalArgumentException("max search iterations must be >= 1: " + iterations);
            }
            this.maxSearchIterations = iterations;
            return this;
        }

        public Builder setParallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public DugrOptions build(){
            return new DugrOptions(this);
        }
    }
}
