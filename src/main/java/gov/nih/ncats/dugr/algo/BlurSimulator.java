package gov.nih.ncats.dugr.algo;

import java.util.logging.Logger;
import java.util.stream.IntStream;

import gov.nih.ncats.dugr.DugrOptions;
import gov.nih.ncats.dugr.InvalidInputException;
import gov.nih.ncats.dugr.image.LuminanceField;

/**
 * Simulates the limited resolving power of the eye by convolving the
 * luminance field with a Gaussian whose full width at half maximum equals
 * the eye resolution angle at the viewing distance.
 * <p>
 * Out of image pixels take the value of the nearest edge pixel. Invalid pixels
 * do not contribute; the weights of the remaining pixels are renormalized.
 */
public class BlurSimulator {
    private static final Logger logger =
        Logger.getLogger (BlurSimulator.class.getName ());

    /**
     * FWHM / sigma of a Gaussian: 2*sqrt(2*ln 2).
     */
    static final double FWHM_PER_SIGMA = 2*Math.sqrt(2*Math.log(2));

    private final double resolutionAngle;
    private final double accuracy;
    private final boolean parallel;

    public BlurSimulator(){
        this(DugrOptions.defaults());
    }

    public BlurSimulator(DugrOptions options){
        this(options.getEyeResolutionAngle(), options.getBlurAccuracy(), options.isParallel());
    }

    public BlurSimulator(double resolutionAngle, double accuracy, boolean parallel){
        this.resolutionAngle = resolutionAngle;
        this.accuracy = accuracy;
        this.parallel = parallel;
    }

    /**
     * Standard deviation of the blur in pixels of the given field.
     */
    public double sigmaInPixels(LuminanceField field, double viewingDistance) throws InvalidInputException{
        checkDistance(viewingDistance);
        return resolutionAngle / FWHM_PER_SIGMA / field.pixelAngleAt(viewingDistance);
    }

    /**
     * @return a new field of identical size, geometry and validity holding the perceived luminance.
     * @throws InvalidInputException if the viewing distance is not a positive number.
     */
    public LuminanceField blur(LuminanceField field, double viewingDistance) throws InvalidInputException{
        double sigma = sigmaInPixels(field, viewingDistance);
        double[] kernel = makeKernel(sigma, accuracy);
        logger.fine("blur sigma=" + sigma + " px, kernel radius=" + (kernel.length-1));

        int width = field.width();
        int height = field.height();
        int n = width*height;

        double[] num = new double[n];
        double[] den = new double[n];
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                if(field.isValid(x,y)){
                    num[y*width+x] = field.get(x,y);
                    den[y*width+x] = 1;
                }
            }
        }

        double[] numH = new double[n];
        double[] denH = new double[n];
        rows(height).forEach(y->hblur(num, den, numH, denH, width, y, kernel));

        double[] numV = new double[n];
        double[] denV = new double[n];
        rows(height).forEach(y->vblur(numH, denH, numV, denV, width, height, y, kernel));

        double[] out = new double[n];
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                int i = y*width+x;
                if(field.isValid(x,y) && denV[i] >0){
                    out[i] = numV[i]/denV[i];
                }
            }
        }
        return field.withSamples(out);
    }

    private IntStream rows(int height){
        IntStream rows = IntStream.range(0, height);
        return parallel? rows.parallel() : rows;
    }

    private static void checkDistance(double viewingDistance) throws InvalidInputException{
        if(!(viewingDistance >0) || Double.isInfinite(viewingDistance)){
            throw new InvalidInputException("viewing distance must be positive: " + viewingDistance);
        }
    }

    /**
     * One sided normalized Gaussian kernel; element k is the weight at offset +/-k.
     * The radius is where the Gaussian drops below {@code accuracy}.
     */
    static double[] makeKernel(double sigma, double accuracy){
        int radius = (int)Math.ceil(sigma*Math.sqrt(-2*Math.log(accuracy)));
        double[] kernel = new double[radius+1];
        double sum = 0;
        for(int k=0;k<=radius;k++){
            kernel[k] = Math.exp(-0.5*k*k/(sigma*sigma));
            sum += k==0? kernel[k] : 2*kernel[k];
        }
        for(int k=0;k<=radius;k++){
            kernel[k] /= sum;
        }
        return kernel;
    }

    /**
     * Horizontal pass of one row, summing from the leftmost to the rightmost offset.
     */
    private static void hblur(double[] num, double[] den, double[] numOut, double[] denOut,
                              int width, int y, double[] kernel){
        int r = kernel.length-1;
        int row = y*width;
        for(int x=0;x<width;x++){
            double sn=0, sd=0;
            for(int k=-r;k<=r;k++){
                int xx = Math.min(width-1, Math.max(0, x+k));
                double w = kernel[Math.abs(k)];
                sn += w*num[row+xx];
                sd += w*den[row+xx];
            }
            numOut[row+x]=sn;
            denOut[row+x]=sd;
        }
    }

    /**
     * Vertical pass writing one output row, summing from the top to the bottom offset.
     */
    private static void vblur(double[] num, double[] den, double[] numOut, double[] denOut,
                              int width, int height, int y, double[] kernel){
        int r = kernel.length-1;
        for(int x=0;x<width;x++){
            double sn=0, sd=0;
            for(int k=-r;k<=r;k++){
                int yy = Math.min(height-1, Math.max(0, y+k));
                double w = kernel[Math.abs(k)];
                sn += w*num[yy*width+x];
                sd += w*den[yy*width+x];
            }
            numOut[y*width+x]=sn;
            denOut[y*width+x]=sd;
        }
    }
}
