package gov.nih.ncats.dugr.image;

import java.util.List;
import java.util.stream.Collectors;

import gov.nih.ncats.dugr.util.CachedSupplier;

/**
 * The pixels of a luminance field that belong to the light emitting surface.
 * Immutable; every accessor returns copies.
 */
public final class LuminousAreaMask {

    private final Bitmap mask;
    private final double threshold;

    private final CachedSupplier<List<Bitmap>> components;

    /**
     * @param mask the luminous pixels; copied.
     * @param threshold the resolved luminance threshold in cd/m&sup2; the mask was detected with.
     */
    public LuminousAreaMask(Bitmap mask, double threshold){
        this.mask = new Bitmap(mask);
        this.threshold = threshold;
        this.components = CachedSupplier.of(()-> this.mask.connectedComponents());
    }

    public int width(){
        return mask.width();
    }

    public int height(){
        return mask.height();
    }

    public boolean get(int x, int y){
        return mask.get(x, y);
    }

    public Bitmap getMask(){
        return new Bitmap(mask);
    }

    public int getPixelCount(){
        return mask.countOn();
    }

    public double getThreshold(){
        return threshold;
    }

    /**
     * The 8-connected components of the mask in raster order of their first pixel.
     */
    public List<Bitmap> getComponents(){
        return components.get().stream()
                .map(Bitmap::new)
                .collect(Collectors.toList());
    }

    public int getComponentCount(){
        return components.get().size();
    }
}
