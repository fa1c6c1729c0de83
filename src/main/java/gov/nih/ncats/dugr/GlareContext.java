package gov.nih.ncats.dugr;

import java.util.Optional;

import gov.nih.ncats.dugr.algo.GuthPositionIndex;

/**
 * Observer and photometric context of one glare assessment.
 * Values are checked when the evaluation runs so that bad values
 * are reported as {@link InvalidInputException}s.
 * Instances are immutable; the {@code with} methods return modified copies.
 */
public final class GlareContext {

    private final double viewingDistance;
    private final double backgroundLuminance;
    private final double positionIndex;
    private final double luminousIntensity;
    private final double luminousArea;

    private GlareContext(double viewingDistance, double backgroundLuminance, double positionIndex,
                         double luminousIntensity, double luminousArea){
        this.viewingDistance = viewingDistance;
        this.backgroundLuminance = backgroundLuminance;
        this.positionIndex = positionIndex;
        this.luminousIntensity = luminousIntensity;
        this.luminousArea = luminousArea;
    }

    /**
     * @param viewingDistance distance between the observer and the luminaire in meters.
     * @param backgroundLuminance background luminance in cd/m&sup2;.
     */
    public static GlareContext of(double viewingDistance, double backgroundLuminance){
        return new GlareContext(viewingDistance, backgroundLuminance, 1, Double.NaN, Double.NaN);
    }

    public GlareContext withPositionIndex(double p){
        return new GlareContext(viewingDistance, backgroundLuminance, p, luminousIntensity, luminousArea);
    }

    /**
     * Set the position index from the observer angles.
     * @see GuthPositionIndex#compute(double, double)
     */
    public GlareContext withGuthAngles(double alphaDegrees, double betaDegrees){
        return withPositionIndex(GuthPositionIndex.compute(alphaDegrees, betaDegrees));
    }

    /**
     * @param intensity luminous intensity of the luminaire towards the observer in cd.
     * @param projectedArea projected luminous area of the luminaire in m&sup2;.
     */
    public GlareContext withLuminaire(double intensity, double projectedArea){
        return new GlareContext(viewingDistance, backgroundLuminance, positionIndex, intensity, projectedArea);
    }

    public double getViewingDistance() {
        return viewingDistance;
    }

    public double getBackgroundLuminance() {
        return backgroundLuminance;
    }

    public double getPositionIndex() {
        return positionIndex;
    }

    public Optional<Double> getLuminousIntensity() {
        return Double.isNaN(luminousIntensity)? Optional.empty() : Optional.of(luminousIntensity);
    }

    public Optional<Double> getLuminousArea() {
        return Double.isNaN(luminousArea)? Optional.empty() : Optional.of(luminousArea);
    }

    public boolean hasLuminaireData(){
        return !Double.isNaN(luminousIntensity) && !Double.isNaN(luminousArea);
    }

    @Override
    public String toString() {
        return "GlareContext{" +
                "viewingDistance=" + viewingDistance +
                ", backgroundLuminance=" + backgroundLuminance +
                ", positionIndex=" + positionIndex +
                ", luminousIntensity=" + luminousIntensity +
                ", luminousArea=" + luminousArea +
                '}';
    }
}
