package gov.nih.ncats.dugr.algo;

/**
 * Guth position index as tabulated for the unified glare rating (CIE 117).
 */
public final class GuthPositionIndex {

    private GuthPositionIndex(){
        //can not instantiate
    }

    /**
     * @param alpha angle from the vertical of the plane containing the source and
     *              the line of sight, in degrees [0, 180].
     * @param beta angle between the line of sight and the line from the observer
     *             to the source, in degrees [0, 90).
     * @return the position index p, 1 for a source on the line of sight.
     */
    public static double compute(double alpha, double beta){
        if(!(alpha >=0 && alpha <=180)){
            throw new IllegalArgumentException("alpha must be in [0,180] degrees: " + alpha);
        }
        if(!(beta >=0 && beta <90)){
            throw new IllegalArgumentException("beta must be in [0,90) degrees: " + beta);
        }
        double a = (35.2 - 0.31889*alpha - 1.22*Math.exp(-2*alpha/9)) * 1E-3 * beta;
        double b = (21 + 0.26667*alpha - 0.002963*alpha*alpha) * 1E-5 * beta*beta;
        return Math.exp(a + b);
    }
}
