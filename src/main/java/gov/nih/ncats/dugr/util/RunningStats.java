package gov.nih.ncats.dugr.util;

/**
 * Accumulates count, sum, sum of squares, min and max of a sequence of values.
 * Values are summed in the order they are added so the same sequence
 * always produces bit identical results.
 */
public final class RunningStats {

    private final double defaultValue;
    private double sum;
    private double sumSquares;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private int num;

    public RunningStats(){
        this(0);
    }

    public RunningStats(double defaultValue){
        this.defaultValue = defaultValue;
    }

    public void add(double value){
        sum+=value;
        sumSquares+=value*value;
        if(value<min){
            min=value;
        }
        if(value>max){
            max=value;
        }
        num++;
    }

    public void addAll(RunningStats other){
        sum+=other.sum;
        sumSquares+=other.sumSquares;
        min=Math.min(min, other.min);
        max=Math.max(max, other.max);
        num+=other.num;
    }

    public int count(){
        return num;
    }

    public double sum(){
        return sum;
    }

    public double computeAvg(){
        if(num==0){
            return defaultValue;
        }
        return sum/num;
    }

    /**
     * Population variance; never negative even when rounding
     * makes the raw difference slightly below zero.
     */
    public double computeVariance(){
        if(num==0){
            return 0;
        }
        double mean = sum/num;
        return Math.max(0, sumSquares/num - mean*mean);
    }

    public double computeStdev(){
        return Math.sqrt(computeVariance());
    }

    public double min(){
        return num==0? defaultValue : min;
    }

    public double max(){
        return num==0? defaultValue : max;
    }
}
