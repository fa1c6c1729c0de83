package gov.nih.ncats.dugr.segmentation;

import java.util.Objects;

import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceStats;

/**
 * An approximately uniform part of the luminous surface.
 * Immutable.
 */
public final class PartialArea {

    private final String name;
    private final Bitmap pixels;
    private final int pixelCount;
    private final double meanLuminance;
    private final double minLuminance;
    private final double maxLuminance;
    private final double stdev;
    private final double solidAngle;
    private final int firstPixelIndex;

    /**
     * @param name the name of this area.
     * @param pixels the pixels of this area; copied.
     * @param stats the luminance statistics of those pixels.
     * @param solidAnglePerPixel solid angle of one pixel at the viewing distance in sr.
     */
    public PartialArea(String name, Bitmap pixels, LuminanceStats stats, double solidAnglePerPixel){
        this.name = Objects.requireNonNull(name);
        this.pixels = new Bitmap(pixels);
        this.pixelCount = stats.count;
        this.meanLuminance = stats.mean;
        this.minLuminance = stats.min;
        this.maxLuminance = stats.max;
        this.stdev = stats.stdev;
        this.solidAngle = stats.count * solidAnglePerPixel;
        this.firstPixelIndex = pixels.firstOnIndex();
    }

    private PartialArea(String name, PartialArea copy){
        this.name = name;
        this.pixels = copy.pixels;
        this.pixelCount = copy.pixelCount;
        this.meanLuminance = copy.meanLuminance;
        this.minLuminance = copy.minLuminance;
        this.maxLuminance = copy.maxLuminance;
        this.stdev = copy.stdev;
        this.solidAngle = copy.solidAngle;
        this.firstPixelIndex = copy.firstPixelIndex;
    }

    /**
     * The same area under a different name.
     */
    public PartialArea rename(String newName){
        return new PartialArea(Objects.requireNonNull(newName), this);
    }

    public String getName() {
        return name;
    }

    public Bitmap getPixels() {
        return new Bitmap(pixels);
    }

    public boolean contains(int x, int y){
        return pixels.get(x, y);
    }

    public int getPixelCount() {
        return pixelCount;
    }

    public double getMeanLuminance() {
        return meanLuminance;
    }

    public double getMinLuminance() {
        return minLuminance;
    }

    public double getMaxLuminance() {
        return maxLuminance;
    }

    public double getStdev() {
        return stdev;
    }

    /**
     * Solid angle in steradians seen from the viewing position.
     */
    public double getSolidAngle() {
        return solidAngle;
    }

    /**
     * Raster index of the first pixel of this area.
     */
    public int getFirstPixelIndex() {
        return firstPixelIndex;
    }

    @Override
    public String toString() {
        return "PartialArea{" +
                "name='" + name + '\'' +
                ", pixelCount=" + pixelCount +
                ", meanLuminance=" + meanLuminance +
                ", solidAngle=" + solidAngle +
                '}';
    }
}
