package gov.nih.ncats.dugr.algo;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.dugr.NoLuminousAreaException;
import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceField;
import gov.nih.ncats.dugr.image.LuminousAreaMask;
import gov.nih.ncats.dugr.image.binarization.DetectionThreshold;

public class LuminousAreaDetectorTest {

    private static final int SIZE = 30;

    private static void fill(double[] samples, int x0, int y0, int w, int h, double value){
        for(int y=y0;y<y0+h;y++){
            for(int x=x0;x<x0+w;x++){
                samples[y*SIZE+x] = value;
            }
        }
    }

    private static LuminanceField field(double[] samples){
        return new LuminanceField(SIZE, SIZE, samples, 1E-3);
    }

    @Test
    public void thresholdAboveMaximumFindsNothing(){
        double[] samples = new double[SIZE*SIZE];
        fill(samples, 5, 5, 6, 6, 3000);
        LuminousAreaDetector detector = new LuminousAreaDetector(DetectionThreshold.absolute(5000), 1, 9);
        try{
            detector.detect(field(samples));
            fail("expected NoLuminousAreaException");
        }catch(NoLuminousAreaException e){
            assertEquals(5000, e.getThreshold(), 0);
            assertEquals(3000, e.getMaxLuminance(), 0);
        }
    }

    @Test
    public void smallComponentsAreRemoved() throws NoLuminousAreaException{
        double[] samples = new double[SIZE*SIZE];
        fill(samples, 5, 5, 5, 5, 1000);
        fill(samples, 20, 20, 2, 2, 1000);
        LuminousAreaMask mask = new LuminousAreaDetector().detect(field(samples));
        assertEquals(25, mask.getPixelCount());
        assertEquals(1, mask.getComponentCount());
        assertFalse(mask.get(20, 20));
        assertTrue(mask.get(5, 5));
        assertEquals(500, mask.getThreshold(), 0);
    }

    @Test
    public void onlyNoiseIsNoLuminousArea(){
        double[] samples = new double[SIZE*SIZE];
        fill(samples, 3, 3, 2, 2, 1000);
        fill(samples, 20, 20, 1, 3, 1000);
        try{
            new LuminousAreaDetector().detect(field(samples));
            fail("expected NoLuminousAreaException");
        }catch(NoLuminousAreaException e){
            assertEquals(1000, e.getMaxLuminance(), 0);
        }
    }

    @Test
    public void holesAreClosed() throws NoLuminousAreaException{
        double[] samples = new double[SIZE*SIZE];
        fill(samples, 10, 10, 7, 7, 2000);
        samples[13*SIZE+13] = 100;
        LuminousAreaMask mask = new LuminousAreaDetector().detect(field(samples));
        assertTrue(mask.get(13, 13));
        assertEquals(49, mask.getPixelCount());
    }

    @Test
    public void maskOnlyContainsValidPixels() throws NoLuminousAreaException{
        double[] samples = new double[SIZE*SIZE];
        fill(samples, 10, 10, 7, 7, 2000);
        Bitmap valid = Bitmap.filled(SIZE, SIZE);
        valid.set(13, 13, false);
        LuminanceField f = new LuminanceField(SIZE, SIZE, samples, 1E-3, Double.NaN, valid);
        LuminousAreaMask mask = new LuminousAreaDetector().detect(f);
        assertFalse(mask.get(13, 13));
        assertEquals(48, mask.getPixelCount());
    }

    @Test
    public void separateSourcesAreSeparateComponents() throws NoLuminousAreaException{
        double[] samples = new double[SIZE*SIZE];
        fill(samples, 2, 2, 6, 6, 2000);
        fill(samples, 15, 15, 6, 6, 8000);
        LuminousAreaMask mask = new LuminousAreaDetector(DetectionThreshold.relative(0.1), 1, 9).detect(field(samples));
        assertEquals(2, mask.getComponentCount());
        assertEquals(mask.getMask(), mask.getComponents().get(0).or(mask.getComponents().get(1)));
        assertEquals(800, mask.getThreshold(), 0);
    }
}
