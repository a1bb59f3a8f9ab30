package tripod.dustfit.core;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import tripod.dustfit.mcmc.LogDensity;

/**
 * log posterior = log prior + log likelihood. The likelihood is only
 * evaluated inside the prior volume.
 */
public class Posterior implements LogDensity {
    private static final Logger logger =
        Logger.getLogger(Posterior.class.getName());

    final Prior prior;
    final CensoredLikelihood likelihood;
    private final AtomicLong suppressed = new AtomicLong ();

    public Posterior (Prior prior, CensoredLikelihood likelihood) {
        if (prior.getType() != likelihood.getModel().getType()) {
            throw new IllegalArgumentException
                ("Prior is for "+prior.getType()+" but the likelihood is for "
                 +likelihood.getModel().getType());
        }
        this.prior = prior;
        this.likelihood = likelihood;
    }

    public Prior getPrior () { return prior; }
    public CensoredLikelihood getLikelihood () { return likelihood; }
    public int getDimension () { return prior.getType().getNumParams(); }

    public double logDensity (double[] theta) {
        double lp = prior.logPrior(theta);
        if (Double.isNaN(lp) || Double.isInfinite(lp))
            return Double.NEGATIVE_INFINITY;

        double lnl = likelihood.logLikelihood(theta);
        if (Double.isNaN(lnl)) {
            // overflowing flux terms far from the data; harmless
            long n = suppressed.incrementAndGet();
            if (n == 1 || n % 10000 == 0) {
                logger.fine(n+" NaN likelihood(s) treated as -infinity");
            }
            return Double.NEGATIVE_INFINITY;
        }
        return lp + lnl;
    }

    /**
     * number of NaN likelihood values reported as -infinity
     */
    public long getSuppressedCount () { return suppressed.get(); }
}
