package tripod.dustfit.mcmc;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.math.random.RandomGenerator;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math.stat.descriptive.rank.Median;

/**
 * Runs an ensemble sampler several times in a row and, between runs,
 * repairs the ensemble: walkers that ended up at non-finite positions
 * are moved next to a healthy walker, and walkers further than
 * sigmaClip standard deviations from the ensemble median (in any
 * dimension) are re-drawn around a randomly chosen surviving walker.
 * Walkers ejected into regions of vanishing probability would otherwise
 * drag the post burn-in statistics.
 *
 * A controller owns its ensemble for the duration of a fit and must not
 * be shared between fits.
 */
public class ConvergenceController {
    private static final Logger logger =
        Logger.getLogger(ConvergenceController.class.getName());

    public enum State {
        INIT,
        RUNNING,
        CHECK,
        REPAIR,
        DONE
    }

    public static final double INVALID_JITTER = 1e-4;
    public static final double MIN_STD = 1e-10;
    public static final int MAX_INIT_ROUNDS = 1000;

    final EnsembleSampler sampler;
    final LogDensity prior;
    final double[] lower, upper; // box walkers are initialized in
    final RandomGenerator rng;

    private int steps = 1000;
    private int repeats = 3;
    private double sigmaClip = 2.;

    private State state = State.INIT;
    private int invalidCount, outlierCount;

    public ConvergenceController (EnsembleSampler sampler, LogDensity prior,
                                  double[] lower, double[] upper,
                                  RandomGenerator rng) {
        if (lower.length != upper.length
            || lower.length != prior.getDimension()) {
            throw new IllegalArgumentException
                ("Initial box has dimension "+lower.length+"/"+upper.length
                 +" but the prior has dimension "+prior.getDimension());
        }
        for (int d = 0; d < lower.length; ++d) {
            if (!(lower[d] < upper[d])) {
                throw new IllegalArgumentException
                    ("Invalid initial range ["+lower[d]+","+upper[d]
                     +"] for dimension "+d);
            }
        }
        this.sampler = sampler;
        this.prior = prior;
        this.lower = (double[])lower.clone();
        this.upper = (double[])upper.clone();
        this.rng = rng;
    }

    public ConvergenceController setSteps (int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException
                ("Number of steps must be positive but got "+steps);
        }
        this.steps = steps;
        return this;
    }
    public int getSteps () { return steps; }

    public ConvergenceController setRepeats (int repeats) {
        if (repeats < 1) {
            throw new IllegalArgumentException
                ("Number of repeats must be positive but got "+repeats);
        }
        this.repeats = repeats;
        return this;
    }
    public int getRepeats () { return repeats; }

    public ConvergenceController setSigmaClip (double sigmaClip) {
        if (!(sigmaClip > 0.)) {
            throw new IllegalArgumentException
                ("Sigma clip must be positive but got "+sigmaClip);
        }
        this.sigmaClip = sigmaClip;
        return this;
    }
    public double getSigmaClip () { return sigmaClip; }

    public State getState () { return state; }

    /**
     * number of non-finite walkers found by the last repair
     */
    public int getInvalidCount () { return invalidCount; }

    /**
     * number of outlier walkers found by the last repair
     */
    public int getOutlierCount () { return outlierCount; }

    /**
     * Uniform draws inside the initial box, keeping only those the prior
     * accepts, until there are exactly the requested number of walkers.
     */
    public double[][] initialPositions (int walkers) {
        if (walkers < 1) {
            throw new IllegalArgumentException
                ("Number of walkers must be positive but got "+walkers);
        }
        state = State.INIT;

        double[][] pos = new double[walkers][];
        int n = 0;
        for (int round = 0; n < walkers && round < MAX_INIT_ROUNDS; ++round) {
            for (int k = 0; k < walkers && n < walkers; ++k) {
                double[] theta = new double[lower.length];
                for (int d = 0; d < theta.length; ++d)
                    theta[d] = lower[d]
                        + (upper[d] - lower[d]) * rng.nextDouble();
                double lp = prior.logDensity(theta);
                if (!Double.isNaN(lp) && !Double.isInfinite(lp))
                    pos[n++] = theta;
            }
        }

        if (n < walkers) {
            throw new IllegalArgumentException
                ("Only "+n+" of "+walkers+" initial positions fall inside "
                 +"the prior; check the initial ranges");
        }
        return pos;
    }

    /**
     * Run the sampler repeats times with steps steps each, starting at
     * the given positions, repairing the ensemble between runs. Returns
     * the concatenated chain of all runs.
     */
    public Chain run (double[][] start) {
        state = State.RUNNING;
        logger.info("Starting MCMC run 1 of "+repeats+"...");
        Chain chain = sampler.run(start, steps);

        for (int i = 1; i < repeats; ++i) {
            double[][] pos = repair (chain.lastPositions());

            state = State.RUNNING;
            logger.info("Starting MCMC run "+(i+1)+" of "+repeats+"...");
            chain = chain.append(sampler.run(pos, steps));
        }

        state = State.DONE;
        return chain;
    }

    /**
     * The check and repair done between two runs. The given positions
     * aren't modified.
     */
    public double[][] repair (double[][] last) {
        state = State.CHECK;
        int walkers = last.length, ndim = last[0].length;
        double[][] pos = new double[walkers][];
        for (int k = 0; k < walkers; ++k)
            pos[k] = (double[])last[k].clone();

        List<Integer> valid = new ArrayList<Integer>();
        List<Integer> invalid = new ArrayList<Integer>();
        for (int k = 0; k < walkers; ++k) {
            if (isFinite (pos[k])) valid.add(k);
            else invalid.add(k);
        }

        invalidCount = invalid.size();
        if (!invalid.isEmpty()) {
            state = State.REPAIR;
            if (valid.isEmpty()) {
                logger.warning("All "+walkers+" walkers have invalid "
                               +"positions; re-initializing the ensemble");
                pos = initialPositions (walkers);
                state = State.REPAIR;
            }
            else {
                logger.info("Found "+invalid.size()+" walkers with invalid "
                            +"positions. Replacing them...");
                for (Integer k : invalid) {
                    double[] src = pos[valid.get(rng.nextInt(valid.size()))];
                    double[] p = new double[ndim];
                    for (int d = 0; d < ndim; ++d)
                        p[d] = src[d] + INVALID_JITTER * rng.nextGaussian();
                    pos[k] = p;
                }
            }
        }

        double[] medians = new double[ndim];
        double[] stds = new double[ndim];
        for (int d = 0; d < ndim; ++d) {
            double[] x = new double[walkers];
            for (int k = 0; k < walkers; ++k)
                x[k] = pos[k][d];
            medians[d] = new Median().evaluate(x);
            stds[d] = Math.max(new StandardDeviation(false).evaluate(x),
                               MIN_STD);
        }

        List<Integer> kept = new ArrayList<Integer>();
        List<Integer> outliers = new ArrayList<Integer>();
        for (int k = 0; k < walkers; ++k) {
            boolean ok = true;
            for (int d = 0; d < ndim && ok; ++d)
                ok = Math.abs(pos[k][d] - medians[d]) < sigmaClip * stds[d];
            if (ok) kept.add(k);
            else outliers.add(k);
        }

        outlierCount = outliers.size();
        if (outliers.isEmpty()) {
            logger.info("All walkers are within the "+sigmaClip
                        +"-sigma range.");
            return pos;
        }

        if (kept.isEmpty()) {
            logger.warning("All "+walkers+" walkers are outside the "
                           +sigmaClip+"-sigma range; skipping the repair");
            return pos;
        }

        state = State.REPAIR;
        logger.info("Found "+outliers.size()+" walkers outside "+sigmaClip
                    +"-sigma range. Replacing with new walkers drawn from "
                    +"within the clipped distribution...");
        double[][] repaired = new double[walkers][];
        for (int k = 0; k < walkers; ++k)
            repaired[k] = pos[k];
        for (Integer k : outliers) {
            double[] src = pos[kept.get(rng.nextInt(kept.size()))];
            double[] p = new double[ndim];
            for (int d = 0; d < ndim; ++d)
                p[d] = src[d] + stds[d] / sigmaClip * rng.nextGaussian();
            repaired[k] = p;
        }
        return repaired;
    }

    static boolean isFinite (double[] x) {
        for (double v : x)
            if (Double.isNaN(v) || Double.isInfinite(v))
                return false;
        return true;
    }
}
