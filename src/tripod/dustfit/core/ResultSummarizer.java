package tripod.dustfit.core;

import java.util.logging.Logger;

import org.apache.commons.math.stat.descriptive.rank.Percentile;

import tripod.dustfit.mcmc.Chain;

/**
 * Reduces the retained part of a chain to credible intervals. The 15.87,
 * 50 and 84.13 percentiles bracket +/-1 sigma of a normal distribution.
 *
 * Percentiles are those of commons-math {@link Percentile}, which puts
 * the p-th percentile at position p(n+1)/100 of the sorted sample and
 * interpolates linearly between neighbours. Values written to the
 * parameter tables can therefore differ slightly, for small samples,
 * from tools that use the (n-1)p/100 position.
 */
public class ResultSummarizer {
    private static final Logger logger =
        Logger.getLogger(ResultSummarizer.class.getName());

    static final double P_LOWER = 15.87;
    static final double P_MEDIAN = 50.;
    static final double P_UPPER = 84.13;

    final ModelType type;

    public ResultSummarizer (ModelType type) {
        this.type = type;
    }

    /**
     * Samples past burn-in: with more than one run only the last run
     * (steps samples per walker) is kept, otherwise the first burnIn
     * fraction of the single run is dropped.
     */
    public static double[][] retainedSamples (Chain chain, int steps,
                                              int repeats, double burnIn) {
        if (!(burnIn >= 0. && burnIn < 1.)) {
            throw new IllegalArgumentException
                ("Burn-in must be in [0,1) but got "+burnIn);
        }
        int keep = repeats > 1 ? steps : (int)(steps * (1. - burnIn));
        if (keep < 1 || keep > chain.getSteps()) {
            throw new IllegalArgumentException
                ("Can't keep "+keep+" of "+chain.getSteps()+" steps");
        }
        return chain.flatten(chain.getSteps() - keep);
    }

    public FitResult summarize (Chain chain, int steps, int repeats,
                                double burnIn) {
        double[][] samples = retainedSamples (chain, steps, repeats, burnIn);
        logger.fine("Summarizing "+samples.length+" samples of "+chain);
        return summarize (samples);
    }

    public FitResult summarize (double[][] samples) {
        if (samples.length == 0) {
            throw new IllegalArgumentException ("No samples to summarize");
        }

        int ndim = type.getNumParams();
        Estimate[] params = new Estimate[ndim];
        for (int d = 0; d < ndim; ++d) {
            double[] x = new double[samples.length];
            for (int i = 0; i < x.length; ++i)
                x[i] = samples[i][d];
            params[d] = estimate (x);
        }

        double[] total = new double[samples.length];
        for (int i = 0; i < total.length; ++i) {
            for (int d = 0; d < ndim; ++d) {
                if (type.getParam(d).isLogMass())
                    total[i] += Math.pow(10., samples[i][d]);
            }
        }

        return new FitResult (type, params, estimate (total));
    }

    static Estimate estimate (double[] x) {
        Percentile pct = new Percentile ();
        double lo = pct.evaluate(x, P_LOWER);
        double med = pct.evaluate(x, P_MEDIAN);
        double hi = pct.evaluate(x, P_UPPER);
        return new Estimate (med, hi - med, med - lo);
    }
}
