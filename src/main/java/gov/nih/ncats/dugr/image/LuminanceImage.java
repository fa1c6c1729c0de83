package gov.nih.ncats.dugr.image;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Raw pixel values of a luminance image as read from a file, together
 * with whatever header information the file format carries.
 * The samples have no geometry until they are turned into a {@link LuminanceField}.
 */
public final class LuminanceImage {
    private static final Logger logger =
        Logger.getLogger (LuminanceImage.class.getName ());

    private final int width;
    private final int height;
    private final double[] samples;
    private final Map<String,String> header;

    public LuminanceImage(int width, int height, double[] samples){
        this(width, height, samples, Collections.emptyMap());
    }

    public LuminanceImage(int width, int height, double[] samples, Map<String,String> header){
        if(width <= 0 || height <= 0){
            throw new IllegalArgumentException("bad image size " + width + "x" + height);
        }
        if(samples.length != width*height){
            throw new IllegalArgumentException("expected " + width*height
                    + " samples but got " + samples.length);
        }
        this.width = width;
        this.height = height;
        this.samples = Arrays.copyOf(samples, samples.length);
        this.header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
    }

    public int width(){
        return width;
    }

    public int height(){
        return height;
    }

    public double get(int x, int y){
        return samples[y*width + x];
    }

    /**
     * Header entries of the file, empty for formats without a header.
     */
    public Map<String,String> getHeader(){
        return header;
    }

    /**
     * The whole image as a field measured from the viewing position.
     */
    public LuminanceField toField(double pixelAngle){
        return toField(pixelAngle, Double.NaN, null);
    }

    /**
     * @param pixelAngle angular pitch of one pixel from the measurement position in radians.
     * @param measurementDistance distance of the camera to the luminaire in meters, NaN if unknown.
     * @param roi the region of interest; pixels outside of it are invalid. null means the whole image.
     * @return a field in which non finite samples and pixels outside of the roi are invalid
     *         and negative samples are set to 0.
     */
    public LuminanceField toField(double pixelAngle, double measurementDistance, Rectangle roi){
        Rectangle bounds = new Rectangle(0, 0, width, height);
        Rectangle r = roi == null ? bounds : roi.intersection(bounds);

        double[] values = new double[samples.length];
        Bitmap valid = new Bitmap(width, height);
        int negatives=0;
        for(int y=0;y<height;y++){
            for(int x=0;x<width;x++){
                int i = y*width + x;
                double v = samples[i];
                if(!r.contains(x, y) || Double.isNaN(v) || Double.isInfinite(v)){
                    continue;
                }
                if(v < 0){
                    v = 0;
                    negatives++;
                }
                values[i] = v;
                valid.set(x, y, true);
            }
        }
        if(negatives > 0){
            logger.warning(negatives + " negative samples set to 0");
        }
        return new LuminanceField(width, height, values, pixelAngle, measurementDistance, valid);
    }
}
