package gov.nih.ncats.dugr.algo;

import java.util.logging.Logger;

import gov.nih.ncats.dugr.DugrOptions;
import gov.nih.ncats.dugr.NoLuminousAreaException;
import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceField;
import gov.nih.ncats.dugr.image.LuminanceStats;
import gov.nih.ncats.dugr.image.LuminousAreaMask;
import gov.nih.ncats.dugr.image.binarization.DetectionThreshold;

/**
 * Separates the luminous surface from the background: global threshold,
 * morphological closing to fill small holes, then removal of connected
 * components that are too small to be anything but noise.
 */
public class LuminousAreaDetector {
    private static final Logger logger =
        Logger.getLogger (LuminousAreaDetector.class.getName ());

    private final DetectionThreshold threshold;
    private final int closingRadius;
    private final int minPixels;

    public LuminousAreaDetector(){
        this(DugrOptions.defaults());
    }

    public LuminousAreaDetector(DugrOptions options){
        this(options.getDetectionThreshold(), options.getClosingRadius(), options.getMinPixelsPerArea());
    }

    public LuminousAreaDetector(DetectionThreshold threshold, int closingRadius, int minPixels){
        this.threshold = threshold;
        this.closingRadius = closingRadius;
        this.minPixels = minPixels;
    }

    /**
     * @param field the (blurred) luminance field.
     * @throws NoLuminousAreaException if no pixel survives thresholding and noise removal.
     */
    public LuminousAreaMask detect(LuminanceField field) throws NoLuminousAreaException{
        LuminanceStats stats = field.stats();
        double t = threshold.resolve(stats);

        Bitmap bm = DetectionThreshold.globalThreshold(field, t);
        if(bm.isEmpty()){
            throw new NoLuminousAreaException(t, stats.max);
        }
        int above = bm.countOn();

        bm = bm.close(closingRadius).and(field.getValidMask());

        Bitmap.ComponentLabels labels = bm.connectedComponentLabels();
        int removed=0;
        for(int y=0;y<bm.height();y++){
            for(int x=0;x<bm.width();x++){
                int l = labels.label(x,y);
                if(l!=0 && labels.size(l) < minPixels){
                    bm.set(x, y, false);
                    removed++;
                }
            }
        }
        if(bm.isEmpty()){
            throw new NoLuminousAreaException(t, stats.max);
        }
        logger.fine("threshold " + threshold + " -> " + t + " cd/m2: " + above
                + " pixels above, " + removed + " noise pixels removed, " + bm.countOn() + " luminous pixels");
        return new LuminousAreaMask(bm, t);
    }
}
