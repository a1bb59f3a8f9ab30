package tripod.dustfit.core;

import java.io.Serializable;

/**
 * Median and 1-sigma credible interval of a marginal posterior.
 */
public class Estimate implements Serializable {
    private static final long serialVersionUID = 0x4e8f1a2b3c5d6e7fl;

    private final double median;
    private final double upper; // p84.13 - p50
    private final double lower; // p50 - p15.87

    public Estimate (double median, double upper, double lower) {
        this.median = median;
        this.upper = upper;
        this.lower = lower;
    }

    public double getMedian () { return median; }
    public double getUpper () { return upper; }
    public double getLower () { return lower; }

    public boolean equals (Object obj) {
        if (!(obj instanceof Estimate))
            return false;
        Estimate e = (Estimate)obj;
        return Double.compare(median, e.median) == 0
            && Double.compare(upper, e.upper) == 0
            && Double.compare(lower, e.lower) == 0;
    }

    public int hashCode () {
        long h = Double.doubleToLongBits(median);
        h = 31*h + Double.doubleToLongBits(upper);
        h = 31*h + Double.doubleToLongBits(lower);
        return (int)(h ^ (h >>> 32));
    }

    public String toString () {
        return String.format("%1$.5g +%2$.3g -%3$.3g", median, upper, lower);
    }
}
