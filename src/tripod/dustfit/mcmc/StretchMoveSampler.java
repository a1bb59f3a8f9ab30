package tripod.dustfit.mcmc;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import org.apache.commons.math.random.RandomGenerator;

/**
 * Affine invariant ensemble sampler using the stretch move of Goodman &
 * Weare (2010) with the red-blue split of Foreman-Mackey et al. (2013).
 * The walkers are randomly split into two halves each step and one half
 * is moved using the other as the complementary ensemble.
 *
 * Posterior evaluations for a half ensemble run on a fixed pool of
 * threads when more than one core is requested; all random numbers are
 * drawn on the calling thread so the result only depends on the seed of
 * the random generator and the starting positions.
 */
public class StretchMoveSampler implements EnsembleSampler, Closeable {
    private static final Logger logger =
        Logger.getLogger(StretchMoveSampler.class.getName());

    public static final double DEFAULT_STRETCH = 2.;

    final LogDensity density;
    final RandomGenerator rng;
    final double stretch;
    final int cores;
    private ExecutorService pool;

    private final AtomicLong nonFinite = new AtomicLong ();
    private long proposed, accepted;

    public StretchMoveSampler (LogDensity density, RandomGenerator rng) {
        this (density, rng, DEFAULT_STRETCH, 1);
    }

    public StretchMoveSampler (LogDensity density, RandomGenerator rng,
                               int cores) {
        this (density, rng, DEFAULT_STRETCH, cores);
    }

    public StretchMoveSampler (LogDensity density, RandomGenerator rng,
                               double stretch, int cores) {
        if (density == null || rng == null) {
            throw new IllegalArgumentException
                ("Sampler needs a log density and a random generator");
        }
        if (!(stretch > 1.)) {
            throw new IllegalArgumentException
                ("Stretch scale must be > 1 but got "+stretch);
        }
        if (cores < 1) {
            throw new IllegalArgumentException
                ("Number of cores must be positive but got "+cores);
        }
        this.density = density;
        this.rng = rng;
        this.stretch = stretch;
        this.cores = cores;
        if (cores > 1) {
            pool = Executors.newFixedThreadPool(cores);
        }
    }

    public int getCores () { return cores; }

    /**
     * fraction of all proposals so far that were accepted
     */
    public double getAcceptanceFraction () {
        return proposed > 0 ? (double)accepted / proposed : 0.;
    }

    /**
     * number of posterior evaluations that came back NaN and were
     * treated as -infinity
     */
    public long getNonFiniteCount () { return nonFinite.get(); }

    public Chain run (double[][] positions, int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException
                ("Number of steps must be positive but got "+steps);
        }
        int walkers = positions.length;
        int ndim = density.getDimension();
        if (walkers < 2 * ndim) {
            throw new IllegalArgumentException
                ("Need at least "+(2*ndim)+" walkers for "+ndim
                 +" dimension(s) but got "+walkers);
        }

        double[][] coords = new double[walkers][];
        for (int k = 0; k < walkers; ++k) {
            if (positions[k].length != ndim) {
                throw new IllegalArgumentException
                    ("Walker "+k+" has dimension "+positions[k].length
                     +"; expecting "+ndim);
            }
            coords[k] = (double[])positions[k].clone();
        }
        double[] lnp = evaluate (coords);

        double[][][] chain = new double[walkers][steps][];
        double[][] lnpChain = new double[walkers][steps];
        int[] split = new int[walkers];
        for (int k = 0; k < walkers; ++k)
            split[k] = k % 2;

        long acc0 = accepted, prop0 = proposed;
        for (int step = 0; step < steps; ++step) {
            shuffle (split);
            for (int s = 0; s < 2; ++s) {
                move (coords, lnp, split, s);
            }

            for (int k = 0; k < walkers; ++k) {
                chain[k][step] = (double[])coords[k].clone();
                lnpChain[k][step] = lnp[k];
            }
        }

        logger.fine(steps+" step(s) of "+walkers+" walkers; acceptance "
                    +String.format("%1$.3f", proposed > prop0
                                   ? (double)(accepted - acc0)
                                   / (proposed - prop0) : 0.));
        return new Chain (chain, lnpChain);
    }

    void shuffle (int[] a) {
        for (int i = a.length - 1; i > 0; --i) {
            int j = rng.nextInt(i + 1);
            int t = a[i];
            a[i] = a[j];
            a[j] = t;
        }
    }

    /**
     * Stretch move of all walkers in the given half of the ensemble.
     */
    void move (double[][] coords, double[] lnp, int[] split, int half) {
        List<Integer> active = new ArrayList<Integer>();
        List<Integer> complement = new ArrayList<Integer>();
        for (int k = 0; k < split.length; ++k) {
            if (split[k] == half) active.add(k);
            else complement.add(k);
        }
        if (active.isEmpty() || complement.isEmpty())
            return;

        int ndim = coords[0].length;
        double[][] proposals = new double[active.size()][ndim];
        double[] factors = new double[active.size()];
        for (int i = 0; i < proposals.length; ++i) {
            double u = rng.nextDouble();
            double z = (stretch - 1.) * u + 1.;
            z = z * z / stretch;
            double[] x = coords[active.get(i)];
            double[] c = coords[complement.get
                                (rng.nextInt(complement.size()))];
            for (int d = 0; d < ndim; ++d)
                proposals[i][d] = c[d] - (c[d] - x[d]) * z;
            factors[i] = (ndim - 1.) * Math.log(z);
        }

        double[] newLnp = evaluate (proposals);
        for (int i = 0; i < proposals.length; ++i) {
            int k = active.get(i);
            double lnpdiff = factors[i] + newLnp[i] - lnp[k];
            ++proposed;
            if (lnpdiff > Math.log(rng.nextDouble())) {
                coords[k] = proposals[i];
                lnp[k] = newLnp[i];
                ++accepted;
            }
        }
    }

    /**
     * Evaluate the log density at every point, in parallel if a pool is
     * available; returns once all points are done.
     */
    double[] evaluate (final double[][] points) {
        final double[] lnp = new double[points.length];
        if (pool == null || points.length < 2) {
            for (int i = 0; i < points.length; ++i)
                lnp[i] = logDensity (points[i]);
            return lnp;
        }

        int chunks = Math.min(cores, points.length);
        List<Callable<Void>> tasks = new ArrayList<Callable<Void>>();
        for (int c = 0; c < chunks; ++c) {
            final int start = c * points.length / chunks;
            final int end = (c + 1) * points.length / chunks;
            tasks.add(new Callable<Void> () {
                    public Void call () {
                        for (int i = start; i < end; ++i)
                            lnp[i] = logDensity (points[i]);
                        return null;
                    }
                });
        }

        try {
            for (Future<Void> f : pool.invokeAll(tasks))
                f.get();
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException
                ("Interrupted while evaluating the posterior", ex);
        }
        catch (ExecutionException ex) {
            Throwable t = ex.getCause();
            if (t instanceof RuntimeException)
                throw (RuntimeException)t;
            throw new IllegalStateException
                ("Posterior evaluation failed", t);
        }
        return lnp;
    }

    double logDensity (double[] theta) {
        double lp = density.logDensity(theta);
        if (Double.isNaN(lp)) {
            nonFinite.incrementAndGet();
            return Double.NEGATIVE_INFINITY;
        }
        return lp;
    }

    public void close () {
        if (pool != null) {
            pool.shutdown();
            pool = null;
        }
    }
}
