package gov.nih.ncats.dugr;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.dugr.image.binarization.DetectionThreshold;

public class DugrOptionsTest {

    @Test
    public void defaults(){
        DugrOptions options = DugrOptions.defaults();
        assertEquals(Math.toRadians(2.5/60), options.getEyeResolutionAngle(), 1E-15);
        assertEquals(0.002, options.getBlurAccuracy(), 0);
        assertEquals(5, options.getMaxPartialAreas());
        assertEquals(9, options.getMinPixelsPerArea());
        assertEquals(0.25, options.getUniformityTolerance(), 0);
        assertFalse(options.isParallel());
    }

    @Test
    public void toBuilderKeepsValues(){
        DugrOptions options = DugrOptions.builder()
                .setMaxPartialAreas(3)
                .setDetectionThreshold(DetectionThreshold.relative(0.2))
                .setParallel(true)
                .build();
        DugrOptions copy = options.toBuilder().setMinPixelsPerArea(4).build();
        assertEquals(3, copy.getMaxPartialAreas());
        assertEquals(4, copy.getMinPixelsPerArea());
        assertTrue(copy.isParallel());
        assertSame(options.getDetectionThreshold(), copy.getDetectionThreshold());
        assertEquals(9, options.getMinPixelsPerArea());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroPartialAreasIsInvalid(){
        DugrOptions.builder().setMaxPartialAreas(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void blurAccuracyMustBeBelowOne(){
        DugrOptions.builder().setBlurAccuracy(1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeToleranceIsInvalid(){
        DugrOptions.builder().setUniformityTolerance(-0.1);
    }

    @Test(expected = NullPointerException.class)
    public void thresholdIsRequired(){
        DugrOptions.builder().setDetectionThreshold(null);
    }
}
