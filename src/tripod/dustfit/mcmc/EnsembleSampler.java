package tripod.dustfit.mcmc;

/**
 * An ensemble MCMC sampler that advances a set of walkers in lock-step.
 */
public interface EnsembleSampler {
    /**
     * Advance every walker by the given number of steps starting from
     * positions[walker][dim] and return the step by step history.
     */
    Chain run (double[][] positions, int steps);
}
