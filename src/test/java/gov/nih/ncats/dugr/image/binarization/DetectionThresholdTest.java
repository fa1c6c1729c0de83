package gov.nih.ncats.dugr.image.binarization;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceField;
import gov.nih.ncats.dugr.image.LuminanceStats;

public class DetectionThresholdTest {

    private final LuminanceField field = new LuminanceField(5, 1, new double[]{100, 200, 600, 1000, 2100}, 1E-3);
    private final LuminanceStats stats = field.stats();

    @Test
    public void defaultIsAbsolute500(){
        DetectionThreshold t = DetectionThreshold.defaultThreshold();
        assertEquals(ThresholdPolicy.ABSOLUTE, t.getPolicy());
        assertEquals(500, t.resolve(stats), 0);
    }

    @Test
    public void relativeToMaximum(){
        assertEquals(210, DetectionThreshold.relative(0.1).resolve(stats), 1E-9);
    }

    @Test
    public void fractionOfRange(){
        assertEquals(100 + 0.5*2000, DetectionThreshold.rangeFraction(0.5).resolve(stats), 1E-9);
    }

    @Test
    public void thresholdIsInclusive(){
        Bitmap bm = DetectionThreshold.globalThreshold(field, 600);
        assertFalse(bm.get(1, 0));
        assertTrue(bm.get(2, 0));
        assertTrue(bm.get(4, 0));
        assertEquals(3, bm.countOn());
    }

    @Test
    public void invalidPixelsAreNeverSet(){
        Bitmap valid = Bitmap.filled(5, 1);
        valid.set(4, 0, false);
        LuminanceField f = new LuminanceField(5, 1, field.toArray(), 1E-3, Double.NaN, valid);
        assertFalse(DetectionThreshold.globalThreshold(f, 0).get(4, 0));
        assertEquals(4, DetectionThreshold.globalThreshold(f, 0).countOn());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeValueIsRejected(){
        DetectionThreshold.absolute(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void fractionAboveOneIsRejected(){
        DetectionThreshold.relative(1.5);
    }
}
