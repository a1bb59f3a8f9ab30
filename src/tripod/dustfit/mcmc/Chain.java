package tripod.dustfit.mcmc;

import java.io.Serializable;

/**
 * Recorded positions (walker x step x dim) and log posterior values
 * (walker x step) of an ensemble. A chain handed out by a sampler or
 * controller is never modified afterwards.
 */
public class Chain implements Serializable {
    private static final long serialVersionUID = 0x0e5f6a7b8c9d1e2fl;

    final double[][][] positions;
    final double[][] logProb;

    public Chain (double[][][] positions, double[][] logProb) {
        if (positions.length == 0 || positions.length != logProb.length) {
            throw new IllegalArgumentException
                ("Chain has "+positions.length+" walkers but "
                 +logProb.length+" log probability rows");
        }
        int steps = positions[0].length;
        for (int w = 0; w < positions.length; ++w) {
            if (positions[w].length != steps || logProb[w].length != steps) {
                throw new IllegalArgumentException
                    ("Walker "+w+" has a ragged history");
            }
        }
        this.positions = positions;
        this.logProb = logProb;
    }

    public int getWalkers () { return positions.length; }
    public int getSteps () { return positions[0].length; }
    public int getDimension () {
        return getSteps () > 0 ? positions[0][0].length : 0;
    }

    public double get (int walker, int step, int dim) {
        return positions[walker][step][dim];
    }
    public double getLogProb (int walker, int step) {
        return logProb[walker][step];
    }

    /**
     * copy of the positions after the last step
     */
    public double[][] lastPositions () {
        int last = getSteps () - 1;
        double[][] pos = new double[getWalkers ()][];
        for (int w = 0; w < pos.length; ++w)
            pos[w] = (double[])positions[w][last].clone();
        return pos;
    }

    /**
     * trace[walker][step] of one parameter
     */
    public double[][] trace (int dim) {
        double[][] t = new double[getWalkers ()][getSteps ()];
        for (int w = 0; w < t.length; ++w)
            for (int s = 0; s < t[w].length; ++s)
                t[w][s] = positions[w][s][dim];
        return t;
    }

    /**
     * All samples from the given step onward, walker by walker, as
     * samples[n][dim].
     */
    public double[][] flatten (int fromStep) {
        if (fromStep < 0 || fromStep > getSteps ()) {
            throw new IllegalArgumentException
                ("Invalid start step "+fromStep+" for a chain of "
                 +getSteps ()+" steps");
        }
        int keep = getSteps () - fromStep;
        double[][] samples = new double[getWalkers () * keep][];
        int n = 0;
        for (int w = 0; w < getWalkers (); ++w)
            for (int s = fromStep; s < getSteps (); ++s)
                samples[n++] = (double[])positions[w][s].clone();
        return samples;
    }

    /**
     * true if no position from the given step onward is NaN or infinite
     */
    public boolean isFinite (int fromStep) {
        for (int w = 0; w < getWalkers (); ++w)
            for (int s = fromStep; s < getSteps (); ++s)
                for (double x : positions[w][s])
                    if (Double.isNaN(x) || Double.isInfinite(x))
                        return false;
        return true;
    }

    /**
     * This chain followed by the given one; both must have the same
     * walkers and dimension.
     */
    public Chain append (Chain next) {
        if (next.getWalkers() != getWalkers ()
            || next.getDimension() != getDimension ()) {
            throw new IllegalArgumentException
                ("Can't append a chain of "+next.getWalkers()+"x"
                 +next.getDimension()+" to one of "+getWalkers ()+"x"
                 +getDimension ());
        }
        int steps = getSteps () + next.getSteps();
        double[][][] pos = new double[getWalkers ()][steps][];
        double[][] lp = new double[getWalkers ()][steps];
        for (int w = 0; w < pos.length; ++w) {
            System.arraycopy(positions[w], 0, pos[w], 0, getSteps ());
            System.arraycopy(next.positions[w], 0, pos[w], getSteps (),
                             next.getSteps());
            System.arraycopy(logProb[w], 0, lp[w], 0, getSteps ());
            System.arraycopy(next.logProb[w], 0, lp[w], getSteps (),
                             next.getSteps());
        }
        return new Chain (pos, lp);
    }

    public String toString () {
        return "Chain{walkers="+getWalkers ()+",steps="+getSteps ()
            +",dim="+getDimension ()+"}";
    }
}
