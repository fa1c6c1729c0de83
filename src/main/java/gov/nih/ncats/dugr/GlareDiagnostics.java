package gov.nih.ncats.dugr;

import java.util.Optional;

/**
 * Intermediate values of one evaluation.
 */
public final class GlareDiagnostics {

    private final double blurSigma;
    private final double threshold;
    private final int luminousPixelCount;
    private final double luminousSolidAngle;
    private final double effectiveLuminance;
    private final double maxLuminance;
    private final int componentCount;
    private final int nodeCount;
    private final int splitSearches;
    private final double weightedSum;
    private final double wholeAreaRating;
    private final Double luminaireRating;
    private final Double correctionFactor;

    private GlareDiagnostics(Builder b){
        this.blurSigma = b.blurSigma;
        this.threshold = b.threshold;
        this.luminousPixelCount = b.luminousPixelCount;
        this.luminousSolidAngle = b.luminousSolidAngle;
        this.effectiveLuminance = b.effectiveLuminance;
        this.maxLuminance = b.maxLuminance;
        this.componentCount = b.componentCount;
        this.nodeCount = b.nodeCount;
        this.splitSearches = b.splitSearches;
        this.weightedSum = b.weightedSum;
        this.wholeAreaRating = b.wholeAreaRating;
        this.luminaireRating = b.luminaireRating;
        this.correctionFactor = b.correctionFactor;
    }

    public static Builder builder(){
        return new Builder();
    }

    /**
     * Standard deviation of the eye blur in pixels.
     */
    public double getBlurSigma() {
        return blurSigma;
    }

    /**
     * The resolved detection threshold in cd/m&sup2;.
     */
    public double getThreshold() {
        return threshold;
    }

    public int getLuminousPixelCount() {
        return luminousPixelCount;
    }

    public double getLuminousSolidAngle() {
        return luminousSolidAngle;
    }

    /**
     * Mean luminance of the whole luminous area after the blur.
     */
    public double getEffectiveLuminance() {
        return effectiveLuminance;
    }

    public double getMaxLuminance() {
        return maxLuminance;
    }

    public int getComponentCount() {
        return componentCount;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getSplitSearches() {
        return splitSearches;
    }

    /**
     * Sum of L&sup2;&omega; over the partial areas.
     */
    public double getWeightedSum() {
        return weightedSum;
    }

    /**
     * Classical rating of the whole luminous area taken as one uniform source.
     */
    public double getWholeAreaRating() {
        return wholeAreaRating;
    }

    public Optional<Double> getLuminaireRating() {
        return Optional.ofNullable(luminaireRating);
    }

    public Optional<Double> getCorrectionFactor() {
        return Optional.ofNullable(correctionFactor);
    }

    public static final class Builder{
        private double blurSigma;
        private double threshold;
        private int luminousPixelCount;
        private double luminousSolidAngle;
        private double effectiveLuminance;
        private double maxLuminance;
        private int componentCount;
        private int nodeCount;
        private int splitSearches;
        private double weightedSum;
        private double wholeAreaRating;
        private Double luminaireRating;
        private Double correctionFactor;

        private Builder(){
        }

        public Builder blurSigma(double blurSigma) {
            this.blurSigma = blurSigma;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder luminousPixelCount(int count) {
            this.luminousPixelCount = count;
            return this;
        }

        public Builder luminousSolidAngle(double solidAngle) {
            this.luminousSolidAngle = solidAngle;
            return this;
        }

        public Builder effectiveLuminance(double luminance) {
            this.effectiveLuminance = luminance;
            return this;
        }

        public Builder maxLuminance(double luminance) {
            this.maxLuminance = luminance;
            return this;
        }

        public Builder componentCount(int count) {
            this.componentCount = count;
            return this;
        }

        public Builder nodeCount(int count) {
            this.nodeCount = count;
            return this;
        }

        public Builder splitSearches(int count) {
            this.splitSearches = count;
            return this;
        }

        public Builder weightedSum(double sum) {
            this.weightedSum = sum;
            return this;
        }

        public Builder wholeAreaRating(double rating) {
            this.wholeAreaRating = rating;
            return this;
        }

        public Builder luminaireRating(Optional<Double> rating) {
            this.luminaireRating = rating.orElse(null);
            return this;
        }

        public Builder correctionFactor(Optional<Double> k2) {
            this.correctionFactor = k2.orElse(null);
            return this;
        }

        public GlareDiagnostics build(){
            return new GlareDiagnostics(this);
        }
    }
}
