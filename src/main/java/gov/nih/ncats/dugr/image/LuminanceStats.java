package gov.nih.ncats.dugr.image;

import java.util.Arrays;

import gov.nih.ncats.dugr.util.RunningStats;

/**
 * Luminance statistics of a set of pixels.
 */
public class LuminanceStats {
    public final double min;
    public final double max;
    public final double mean;
    public final double stdev;
    public final double median;
    public final double sum;
    public final int count;

    LuminanceStats(double min, double max, double mean, double stdev, double median, double sum, int count){
        this.min=min;
        this.max=max;
        this.mean=mean;
        this.stdev=stdev;
        this.median=median;
        this.sum=sum;
        this.count=count;
    }

    /**
     * Compute the statistics of the field over the on pixels of the given bitmap,
     * visited in raster order.
     */
    public static LuminanceStats of(LuminanceField field, Bitmap pixels){
        RunningStats rs = new RunningStats();
        double[] values = new double[pixels.countOn()];
        int n=0;
        for(int y=0;y<field.height();y++){
            for(int x=0;x<field.width();x++){
                if(pixels.isOn(x,y)){
                    double v= field.get(x,y);
                    rs.add(v);
                    values[n++]=v;
                }
            }
        }
        if(n==0){
            return new LuminanceStats(0,0,0,0,0,0,0);
        }
        Arrays.sort(values);
        double median = (n%2==1)? values[n/2] : (values[n/2-1]+values[n/2])/2;
        return new LuminanceStats(rs.min(), rs.max(), rs.computeAvg(), rs.computeStdev(), median, rs.sum(), n);
    }

    /**
     * Coefficient of variation (stdev / mean); 0 for an empty or completely dark set.
     */
    public double getUniformityRatio(){
        if(mean<=0){
            return 0;
        }
        return stdev/mean;
    }

    public boolean isEmpty(){
        return count==0;
    }

    @Override
    public String toString() {
        return "LuminanceStats{" +
                "min=" + min +
                ", max=" + max +
                ", mean=" + mean +
                ", stdev=" + stdev +
                ", median=" + median +
                ", count=" + count +
                '}';
    }
}
