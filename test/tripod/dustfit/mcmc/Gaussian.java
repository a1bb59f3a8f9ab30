package tripod.dustfit.mcmc;

/**
 * Standard normal log density in any dimension, optionally truncated to
 * a box; NaN in, NaN out.
 */
class Gaussian implements LogDensity {
    final int ndim;
    final double bound;

    Gaussian (int ndim) {
        this (ndim, Double.POSITIVE_INFINITY);
    }

    Gaussian (int ndim, double bound) {
        this.ndim = ndim;
        this.bound = bound;
    }

    public int getDimension () { return ndim; }

    public double logDensity (double[] theta) {
        double s = 0.;
        for (double x : theta) {
            if (Math.abs(x) >= bound)
                return Double.NEGATIVE_INFINITY;
            s += x * x;
        }
        return -0.5 * s;
    }
}
