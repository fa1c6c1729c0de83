package gov.nih.ncats.dugr.image;

import static org.junit.Assert.*;

import org.junit.Test;

public class LuminanceFieldTest {

    @Test
    public void samplesAreCopied(){
        double[] samples = {1, 2, 3, 4, 5, 6};
        LuminanceField field = new LuminanceField(3, 2, samples, 1E-3);
        samples[0] = 100;
        assertEquals(1, field.get(0, 0), 0);
        assertEquals(6, field.get(2, 1), 0);

        double[] out = field.toArray();
        out[1] = 100;
        assertEquals(2, field.get(1, 0), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeValidSampleIsRejected(){
        new LuminanceField(2, 1, new double[]{1, -1}, 1E-3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nanValidSampleIsRejected(){
        new LuminanceField(2, 1, new double[]{1, Double.NaN}, 1E-3);
    }

    @Test
    public void invalidPixelsMayHoldAnything(){
        Bitmap valid = Bitmap.filled(2, 1);
        valid.set(1, 0, false);
        LuminanceField field = new LuminanceField(2, 1, new double[]{1, Double.NaN}, 1E-3, Double.NaN, valid);
        assertTrue(field.isValid(0, 0));
        assertFalse(field.isValid(1, 0));
        assertEquals(1, field.getValidCount());
        assertEquals(1, field.stats().count);
    }

    @Test(expected = IllegalArgumentException.class)
    public void pixelAngleMustBePositive(){
        new LuminanceField(1, 1, new double[]{1}, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void sampleCountMustMatchSize(){
        new LuminanceField(2, 2, new double[]{1, 2, 3}, 1E-3);
    }

    @Test
    public void withoutMeasurementDistanceThePixelAngleIsTheViewingAngle(){
        LuminanceField field = new LuminanceField(1, 1, new double[]{1}, 2E-4);
        assertFalse(field.getMeasurementDistance().isPresent());
        assertEquals(2E-4, field.pixelAngleAt(3), 0);
        assertEquals(4E-8, field.solidAnglePerPixel(3), 1E-20);
    }

    @Test
    public void pixelAngleShrinksWithViewingDistance(){
        LuminanceField field = new LuminanceField(1, 1, new double[]{1}, 2E-4, 2, null);
        assertEquals(2.0, field.getMeasurementDistance().get(), 0);
        assertEquals(2E-4, field.pixelAngleAt(2), 0);
        double expected = 2*Math.atan(0.5*Math.tan(1E-4));
        assertEquals(expected, field.pixelAngleAt(4), 1E-15);
        assertTrue(field.pixelAngleAt(4) < field.pixelAngleAt(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void viewingDistanceMustBePositive(){
        new LuminanceField(1, 1, new double[]{1}, 2E-4).pixelAngleAt(0);
    }

    @Test
    public void statsOverSubset(){
        LuminanceField field = new LuminanceField(4, 1, new double[]{1, 2, 3, 10}, 1E-3);
        Bitmap bm = new Bitmap(4, 1);
        bm.set(0, 0, true);
        bm.set(1, 0, true);
        bm.set(2, 0, true);
        LuminanceStats stats = field.stats(bm);
        assertEquals(3, stats.count);
        assertEquals(2, stats.mean, 1E-12);
        assertEquals(2, stats.median, 0);
        assertEquals(1, stats.min, 0);
        assertEquals(3, stats.max, 0);
        assertEquals(Math.sqrt(2.0/3), stats.stdev, 1E-12);

        LuminanceStats all = field.stats();
        assertEquals(2.5, all.median, 0);
        assertEquals(16, all.sum, 0);
    }

    @Test
    public void scaleMultipliesEverySample(){
        LuminanceField field = new LuminanceField(2, 1, new double[]{1, 3}, 1E-3, 5, null);
        LuminanceField scaled = field.scale(2);
        assertEquals(2, scaled.get(0, 0), 0);
        assertEquals(6, scaled.get(1, 0), 0);
        assertEquals(field.getPixelAngle(), scaled.getPixelAngle(), 0);
        assertEquals(5.0, scaled.getMeasurementDistance().get(), 0);
    }
}
