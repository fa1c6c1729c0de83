package gov.nih.ncats.dugr.algo;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import gov.nih.ncats.dugr.DugrOptions;
import gov.nih.ncats.dugr.InvalidInputException;
import gov.nih.ncats.dugr.image.Bitmap;
import gov.nih.ncats.dugr.image.LuminanceField;

public class BlurSimulatorTest {

    private static final double PIXEL_ANGLE = 2E-4;

    private static LuminanceField patch(int size, int x0, int y0, int w, int h, double value){
        double[] samples = new double[size*size];
        for(int y=y0;y<y0+h;y++){
            for(int x=x0;x<x0+w;x++){
                samples[y*size+x] = value;
            }
        }
        return new LuminanceField(size, size, samples, PIXEL_ANGLE);
    }

    private static double sum(LuminanceField field){
        return Arrays.stream(field.toArray()).sum();
    }

    @Test
    public void kernelIsNormalized(){
        double[] kernel = BlurSimulator.makeKernel(1.7, 0.002);
        double sum = kernel[0];
        for(int k=1;k<kernel.length;k++){
            sum += 2*kernel[k];
            assertTrue(kernel[k] < kernel[k-1]);
        }
        assertEquals(1, sum, 1E-12);
        assertEquals((int)Math.ceil(1.7*Math.sqrt(-2*Math.log(0.002))), kernel.length-1);
    }

    @Test
    public void sigmaFollowsResolutionAngle() throws InvalidInputException{
        LuminanceField field = patch(10, 0, 0, 1, 1, 1);
        BlurSimulator blur = new BlurSimulator();
        double expected = DugrOptions.DEFAULT_EYE_RESOLUTION / (2*Math.sqrt(2*Math.log(2))) / PIXEL_ANGLE;
        assertEquals(expected, blur.sigmaInPixels(field, 3), 1E-12);
    }

    @Test
    public void blurConservesFlux() throws InvalidInputException{
        LuminanceField field = patch(60, 25, 20, 8, 12, 5000);
        LuminanceField blurred = new BlurSimulator().blur(field, 2);
        assertEquals(sum(field), sum(blurred), 1E-9*sum(field));
        assertTrue(blurred.get(24, 25) > 0);
        assertTrue(blurred.get(28, 25) < 5000);
    }

    @Test
    public void uniformFieldStaysUniform() throws InvalidInputException{
        LuminanceField field = patch(20, 0, 0, 20, 20, 1234);
        LuminanceField blurred = new BlurSimulator().blur(field, 2);
        for(double v : blurred.toArray()){
            assertEquals(1234, v, 1E-9);
        }
    }

    @Test
    public void invalidPixelsDoNotContribute() throws InvalidInputException{
        double[] samples = new double[30*30];
        Arrays.fill(samples, 100);
        Bitmap valid = Bitmap.filled(30, 30);
        for(int y=10;y<20;y++){
            for(int x=10;x<20;x++){
                valid.set(x, y, false);
                samples[y*30+x] = 1E9;
            }
        }
        LuminanceField field = new LuminanceField(30, 30, samples, PIXEL_ANGLE, Double.NaN, valid);
        LuminanceField blurred = new BlurSimulator().blur(field, 2);
        assertEquals(100, blurred.get(9, 15), 1E-9);
        assertEquals(100, blurred.get(20, 12), 1E-9);
        assertFalse(blurred.isValid(15, 15));
        assertEquals(0, blurred.get(15, 15), 0);
        assertEquals(field.getValidMask(), blurred.getValidMask());
    }

    @Test
    public void parallelRowsGiveIdenticalResult() throws InvalidInputException{
        LuminanceField field = patch(80, 10, 30, 40, 7, 9000);
        LuminanceField serial = new BlurSimulator(DugrOptions.DEFAULT_EYE_RESOLUTION, 0.002, false).blur(field, 2);
        LuminanceField parallel = new BlurSimulator(DugrOptions.DEFAULT_EYE_RESOLUTION, 0.002, true).blur(field, 2);
        assertArrayEquals(serial.toArray(), parallel.toArray(), 0);
    }

    @Test
    public void outputKeepsGeometry() throws InvalidInputException{
        LuminanceField field = new LuminanceField(5, 4, new double[20], PIXEL_ANGLE, 1.5, null);
        LuminanceField blurred = new BlurSimulator().blur(field, 3);
        assertEquals(5, blurred.width());
        assertEquals(4, blurred.height());
        assertEquals(PIXEL_ANGLE, blurred.getPixelAngle(), 0);
        assertEquals(1.5, blurred.getMeasurementDistance().get(), 0);
    }

    @Test(expected = InvalidInputException.class)
    public void nonPositiveViewingDistanceIsRejected() throws InvalidInputException{
        new BlurSimulator().blur(patch(5, 0, 0, 1, 1, 1), 0);
    }
}
