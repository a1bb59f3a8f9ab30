package tripod.dustfit.mcmc;

/**
 * Unnormalized log probability density sampled by an ensemble sampler.
 * Implementations must be safe to call from several threads at once.
 */
public interface LogDensity {
    int getDimension ();
    double logDensity (double[] theta);
}
