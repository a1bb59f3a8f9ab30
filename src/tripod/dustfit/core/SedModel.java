package tripod.dustfit.core;

import java.util.logging.Logger;

/**
 * One- or two-component dust spectral energy distribution evaluated for
 * a given photometric data set. The opacity is interpolated once onto
 * the rest-frame wavelength grid at construction, so every evaluation of
 * a parameter vector afterwards only costs the blackbody terms.
 */
public class SedModel {
    private static final Logger logger =
        Logger.getLogger(SedModel.class.getName());

    public static final int DEFAULT_FILTER_SAMPLES = 1000;

    final ModelType type;
    final double redshift;
    final double distance; // cm
    final double[] wave; // observer frame grid the model is evaluated on
    final double[] kappa; // opacity on the rest frame of wave
    final Bandpass[] bandpasses; // null if evaluated at observed points

    public SedModel (ModelType type, Photometry phot, OpacityCurve curve,
                     double redshift, double distance) {
        this (type, phot, curve, redshift, distance,
              DEFAULT_FILTER_SAMPLES, ExtrapolationPolicy.ERROR);
    }

    public SedModel (ModelType type, Photometry phot, OpacityCurve curve,
                     double redshift, double distance, int filterSamples,
                     ExtrapolationPolicy policy) {
        if (type == null) {
            throw new IllegalArgumentException ("No model type given");
        }
        if (curve == null) {
            throw new IllegalArgumentException ("No opacity curve given");
        }
        if (!(distance > 0.) || Double.isInfinite(distance)) {
            throw new IllegalArgumentException
                ("Invalid luminosity distance "+distance+" cm");
        }
        if (!(redshift > -1.)) {
            throw new IllegalArgumentException
                ("Invalid redshift "+redshift);
        }
        phot.validate();

        this.type = type;
        this.redshift = redshift;
        this.distance = distance;
        this.bandpasses = phot.getBandpasses();
        if (bandpasses != null) {
            if (filterSamples < 2) {
                throw new IllegalArgumentException
                    ("Need at least 2 filter samples but got "
                     +filterSamples);
            }
            this.wave = filterGrid (bandpasses, filterSamples);
            logger.fine(phot.getName()+": sampling "+bandpasses.length
                        +" bandpass(es) on "+filterSamples+" points in ["
                        +wave[0]+","+wave[wave.length-1]+"] um");
        }
        else {
            this.wave = phot.getWavelengths();
        }
        this.kappa = curve.interpolate
            (DustEmission.restWavelength(wave, redshift), policy);
    }

    /**
     * Evenly spaced grid spanning the union of all bandpasses.
     */
    static double[] filterGrid (Bandpass[] bandpasses, int samples) {
        double lo = Double.MAX_VALUE, hi = -Double.MAX_VALUE;
        for (Bandpass b : bandpasses) {
            lo = Math.min(lo, b.getMinWavelength());
            hi = Math.max(hi, b.getMaxWavelength());
        }
        double[] grid = new double[samples];
        double step = (hi - lo) / (samples - 1);
        for (int i = 0; i < samples; ++i)
            grid[i] = lo + i * step;
        grid[samples-1] = hi;
        return grid;
    }

    public ModelType getType () { return type; }
    public double getRedshift () { return redshift; }
    public double getDistance () { return distance; }
    public double[] getWavelengths () { return (double[])wave.clone(); }
    public double[] getOpacity () { return (double[])kappa.clone(); }
    public boolean isFilterIntegrated () { return bandpasses != null; }

    /**
     * Model flux (Jy) on the model grid.
     */
    public double[] spectrum (double[] theta) {
        return flux (type, theta, wave, kappa, redshift, distance);
    }

    /**
     * Model flux (Jy) comparable to each observation, i.e. integrated
     * through the bandpasses when the data has them.
     */
    public double[] predict (double[] theta) {
        double[] flux = spectrum (theta);
        if (bandpasses != null) {
            flux = FilterIntegrator.integrate(wave, flux, bandpasses);
        }
        return flux;
    }

    /**
     * Total flux (Jy) of the model on an arbitrary grid; the components
     * are independent so this is the sum of one-component evaluations.
     */
    public static double[] flux (ModelType type, double[] theta,
                                 double[] obsWave, double[] kappa,
                                 double redshift, double distance) {
        type.check(theta);
        double[] flux = DustEmission.modelFlux
            (obsWave, Math.pow(10., theta[0]), theta[1],
             redshift, distance, kappa);
        if (type == ModelType.TWO_COMPONENT) {
            double[] hot = DustEmission.modelFlux
                (obsWave, Math.pow(10., theta[2]), theta[3],
                 redshift, distance, kappa);
            for (int i = 0; i < flux.length; ++i)
                flux[i] += hot[i];
        }
        return flux;
    }

    /**
     * Flux (Jy) of a single component of the model.
     */
    public static double[] componentFlux (double logMass, double temperature,
                                          double[] obsWave, double[] kappa,
                                          double redshift, double distance) {
        return flux (ModelType.ONE_COMPONENT,
                     new double[]{logMass, temperature},
                     obsWave, kappa, redshift, distance);
    }

    public String toString () {
        return "SedModel{type="+type+",z="+redshift+",distance="+distance
            +",grid="+wave.length+",filters="
            +(bandpasses != null ? bandpasses.length : 0)+"}";
    }
}
