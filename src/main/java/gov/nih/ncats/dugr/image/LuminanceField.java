package gov.nih.ncats.dugr.image;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A calibrated luminance map of a luminaire's light emitting surface.
 * <p>
 * Samples are luminances in cd/m&sup2; stored row major. Pixels are square in
 * angle: {@code pixelAngle} is the angular pitch of one pixel in radians as
 * seen from the measurement position. If a measurement distance is known,
 * angles seen from any other viewing distance are derived from it, otherwise the
 * field is assumed to have been measured from the viewing position.
 * <p>
 * Pixels outside of the validity mask are excluded from every statistic.
 * Instances are immutable.
 */
public final class LuminanceField {

    private final int width;
    private final int height;
    private final double[] samples;
    private final double pixelAngle;
    private final double measurementDistance;
    private final Bitmap valid;

    /**
     * Create a field where every pixel is valid and no measurement distance is known.
     */
    public LuminanceField(int width, int height, double[] samples, double pixelAngle){
        this(width, height, samples, pixelAngle, Double.NaN, null);
    }

    /**
     * @param width width in pixels.
     * @param height height in pixels.
     * @param samples luminance samples, row major; copied.
     * @param pixelAngle angular pitch of a pixel in radians, must be &gt; 0.
     * @param measurementDistance distance in meters the image was taken from,
     *                            or {@link Double#NaN} if unknown.
     * @param validMask the valid pixels or {@code null} if every pixel is valid; copied.
     *
     * @throws IllegalArgumentException if the sizes do not match, the pixel angle is not
     * positive, or a valid sample is negative or not finite.
     */
    public LuminanceField(int width, int height, double[] samples, double pixelAngle,
                          double measurementDistance, Bitmap validMask){
        Objects.requireNonNull(samples, "samples can not be null");
        if(width <=0 || height <=0){
            throw new IllegalArgumentException("invalid field size " + width + "x" + height);
        }
        if(samples.length != width*height){
            throw new IllegalArgumentException("expected " + width*height + " samples but was " + samples.length);
        }
        if(!(pixelAngle > 0) || Double.isInfinite(pixelAngle)){
            throw new IllegalArgumentException("pixel angle must be positive: " + pixelAngle);
        }
        if(!Double.isNaN(measurementDistance) && !(measurementDistance >0 && !Double.isInfinite(measurementDistance))){
            throw new IllegalArgumentException("measurement distance must be positive: " + measurementDistance);
        }
        if(validMask !=null && (validMask.width()!=width || validMask.height()!=height)){
            throw new IllegalArgumentException("validity mask size does not match field size");
        }
        this.width = width;
        this.height = height;
        this.samples = Arrays.copyOf(samples, samples.length);
        this.pixelAngle = pixelAngle;
        this.measurementDistance = measurementDistance;
        this.valid = validMask==null? Bitmap.filled(width, height) : new Bitmap(validMask);

        for(int y=0;y<height;y++){
            for(int x=0;x<width;x++){
                if(!valid.isOn(x,y)){
                    continue;
                }
                double v = this.samples[y*width+x];
                if(Double.isNaN(v) || Double.isInfinite(v) || v <0){
                    throw new IllegalArgumentException("invalid luminance " + v + " at (" + x + "," + y + ")");
                }
            }
        }
    }

    public int width(){
        return width;
    }

    public int height(){
        return height;
    }

    /**
     * Luminance at the given pixel. Invalid pixels report whatever sample was stored for them.
     */
    public double get(int x, int y){
        return samples[y*width+x];
    }

    public boolean isValid(int x, int y){
        return valid.get(x, y);
    }

    /**
     * A copy of the validity mask.
     */
    public Bitmap getValidMask(){
        return new Bitmap(valid);
    }

    public int getValidCount(){
        return valid.countOn();
    }

    public double getPixelAngle(){
        return pixelAngle;
    }

    public Optional<Double> getMeasurementDistance(){
        return Double.isNaN(measurementDistance)? Optional.empty() : Optional.of(measurementDistance);
    }

    /**
     * Angular pitch of one pixel as seen from the given viewing distance.
     * @param viewingDistance the distance in meters, must be &gt; 0.
     */
    public double pixelAngleAt(double viewingDistance){
        if(!(viewingDistance >0)){
            throw new IllegalArgumentException("viewing distance must be positive: " + viewingDistance);
        }
        if(Double.isNaN(measurementDistance) || measurementDistance==viewingDistance){
            return pixelAngle;
        }
        return 2*Math.atan(measurementDistance/viewingDistance * Math.tan(pixelAngle/2));
    }

    /**
     * Solid angle in steradians of one pixel seen from the given viewing distance.
     */
    public double solidAnglePerPixel(double viewingDistance){
        double a = pixelAngleAt(viewingDistance);
        return a*a;
    }

    /**
     * Statistics over all valid pixels.
     */
    public LuminanceStats stats(){
        return LuminanceStats.of(this, valid);
    }

    /**
     * Statistics over the valid pixels inside the given bitmap.
     */
    public LuminanceStats stats(Bitmap pixels){
        return LuminanceStats.of(this, pixels.and(valid));
    }

    /**
     * A new field with the same geometry and validity mask but different samples.
     */
    public LuminanceField withSamples(double[] newSamples){
        return new LuminanceField(width, height, newSamples, pixelAngle, measurementDistance, valid);
    }

    /**
     * A new field with every sample multiplied by the given factor.
     */
    public LuminanceField scale(double factor){
        if(!(factor >=0) || Double.isInfinite(factor)){
            throw new IllegalArgumentException("scale factor must be a non-negative number: " + factor);
        }
        double[] scaled = new double[samples.length];
        for(int i=0;i<samples.length;i++){
            scaled[i]=samples[i]*factor;
        }
        return withSamples(scaled);
    }

    /**
     * A copy of the raw samples, row major.
     */
    public double[] toArray(){
        return Arrays.copyOf(samples, samples.length);
    }
}
