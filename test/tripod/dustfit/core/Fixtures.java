package tripod.dustfit.core;

import org.apache.commons.math.random.MersenneTwister;

/**
 * Synthetic opacity and photometry shared by the tests.
 */
public class Fixtures {
    public static final double DISTANCE = 10. * Constants.MEGAPARSEC;
    public static final double[] BANDS = {5., 8., 10., 15., 20., 25.};

    private Fixtures () {}

    /**
     * kappa = 1e3 (lambda/10um)^-1.5 cm^2/g on a log grid over
     * [0.1, 1000] um
     */
    public static OpacityCurve opacity () {
        int n = 200;
        double[] w = new double[n];
        double[] k = new double[n];
        for (int i = 0; i < n; ++i) {
            w[i] = Math.pow(10., -1. + 4. * i / (n - 1));
            k[i] = 1e3 * Math.pow(w[i] / 10., -1.5);
        }
        w[n-1] = 1000.;
        return new OpacityCurve ("synthetic", 0.1, w, k);
    }

    public static double[] flux (ModelType type, double[] theta,
                                 double[] wave, double redshift) {
        double[] kappa = opacity().interpolate
            (DustEmission.restWavelength(wave, redshift),
             ExtrapolationPolicy.ERROR);
        return SedModel.flux(type, theta, wave, kappa, redshift, DISTANCE);
    }

    /**
     * Detections of the given model with errors of errFrac times the
     * flux and Gaussian noise of the same size (none if noisy is false).
     */
    public static Photometry photometry (ModelType type, double[] theta,
                                         double[] wave, double errFrac,
                                         boolean noisy) {
        double[] f = flux (type, theta, wave, 0.);
        MersenneTwister rng = new MersenneTwister (7l);
        Photometry phot = new Photometry ("synthetic");
        for (int i = 0; i < wave.length; ++i) {
            double err = errFrac * f[i];
            double obs = noisy ? f[i] + err * rng.nextGaussian() : f[i];
            phot.add(wave[i], obs, err, false);
        }
        return phot;
    }

    public static Bandpass tophat (String name, double lo, double hi,
                                   int n) {
        double[] w = new double[n];
        double[] t = new double[n];
        for (int i = 0; i < n; ++i) {
            w[i] = lo + (hi - lo) * i / (n - 1);
            t[i] = 1.;
        }
        return new Bandpass (name, w, t);
    }
}
